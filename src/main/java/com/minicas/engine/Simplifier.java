package com.minicas.engine;

import com.minicas.ast.Expression;
import com.minicas.ast.expressions.AddExpression;
import com.minicas.ast.expressions.ConstantExpression;
import com.minicas.ast.expressions.MultiplyExpression;
import com.minicas.ast.expressions.NumericValue;
import com.minicas.ast.expressions.PowerExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Simplifier - 表达式化简器
 *
 * 自底向上化简表达式树: 先化简子节点,再对当前节点应用一层规则。
 *
 * 规则(按优先级):
 * - 加法: 0 + r → r, l + 0 → l, 常量 + 常量 → 折叠
 * - 乘法: 任一侧为0 → 0, 1 * r → r, l * 1 → l, 常量 * 常量 → 折叠
 * - 幂运算: b^0 → 1(包括 0^0), b^1 → b, 常量^常量 → 折叠
 * - 常量、变量: 原样返回
 *
 * 设计原则:
 * - 单遍: 规则产生的新节点不会再次化简,不保证到达不动点
 * - 零状态: 纯函数,不修改输入树
 * - 折叠结果不是有限实数时(如 0^-1)保留幂运算节点
 *
 * 使用示例:
 * <pre>
 * Expression expr = Expressions.add(Expressions.constant(2), Expressions.constant(3));
 * Expression result = simplifier.simplify(expr);
 * // result = 5
 * </pre>
 */
public class Simplifier {

    private static final Logger logger = LoggerFactory.getLogger(Simplifier.class);

    /**
     * 化简表达式
     *
     * @param expr 表达式
     * @return 化简后的表达式(可能是输入本身)
     * @throws IllegalArgumentException 表达式为null
     */
    public Expression simplify(Expression expr) {
        if (expr == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }

        Expression result = simplifyNode(expr);
        if (logger.isDebugEnabled()) {
            logger.debug("simplify {} => {}", expr, result);
        }
        return result;
    }

    private Expression simplifyNode(Expression expr) {
        switch (expr.getType()) {
            case CONSTANT:
            case VARIABLE:
                return expr;

            case ADD:
                return simplifyAdd((AddExpression) expr);

            case MULTIPLY:
                return simplifyMultiply((MultiplyExpression) expr);

            case POWER:
                return simplifyPower((PowerExpression) expr);

            default:
                throw new UnsupportedExpressionException(expr.getType());
        }
    }

    private Expression simplifyAdd(AddExpression expr) {
        Expression left = simplifyNode(expr.getLeft());
        Expression right = simplifyNode(expr.getRight());

        if (isZero(left)) {
            logger.trace("0 + r => r: {}", right);
            return right;
        }
        if (isZero(right)) {
            logger.trace("l + 0 => l: {}", left);
            return left;
        }
        if (isConstant(left) && isConstant(right)) {
            return new ConstantExpression(valueOf(left).add(valueOf(right)));
        }

        return new AddExpression(left, right);
    }

    private Expression simplifyMultiply(MultiplyExpression expr) {
        Expression left = simplifyNode(expr.getLeft());
        Expression right = simplifyNode(expr.getRight());

        if (isZero(left) || isZero(right)) {
            logger.trace("annihilate ({} * {}) => 0", left, right);
            return new ConstantExpression(NumericValue.ZERO);
        }
        if (isOne(left)) {
            return right;
        }
        if (isOne(right)) {
            return left;
        }
        if (isConstant(left) && isConstant(right)) {
            return new ConstantExpression(valueOf(left).multiply(valueOf(right)));
        }

        return new MultiplyExpression(left, right);
    }

    private Expression simplifyPower(PowerExpression expr) {
        Expression base = simplifyNode(expr.getBase());
        Expression exponent = simplifyNode(expr.getExponent());

        // 指数为0优先于常量折叠: 0^0 => 1
        if (isZero(exponent)) {
            return new ConstantExpression(NumericValue.ONE);
        }
        if (isOne(exponent)) {
            return base;
        }
        if (isConstant(base) && isConstant(exponent)) {
            Optional<NumericValue> folded = valueOf(base).power(valueOf(exponent));
            if (folded.isPresent()) {
                return new ConstantExpression(folded.get());
            }
            logger.debug("Power ({}^{}) has no finite real value, left unfolded", base, exponent);
        }

        return new PowerExpression(base, exponent);
    }

    private static boolean isConstant(Expression expr) {
        return expr.getType() == Expression.ExpressionType.CONSTANT;
    }

    private static boolean isZero(Expression expr) {
        return isConstant(expr) && ((ConstantExpression) expr).isZero();
    }

    private static boolean isOne(Expression expr) {
        return isConstant(expr) && ((ConstantExpression) expr).isOne();
    }

    private static NumericValue valueOf(Expression expr) {
        return ((ConstantExpression) expr).getValue();
    }
}
