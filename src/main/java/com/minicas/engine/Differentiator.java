package com.minicas.engine;

import com.minicas.ast.Expression;
import com.minicas.ast.expressions.AddExpression;
import com.minicas.ast.expressions.ConstantExpression;
import com.minicas.ast.expressions.MultiplyExpression;
import com.minicas.ast.expressions.NumericValue;
import com.minicas.ast.expressions.PowerExpression;
import com.minicas.ast.expressions.VariableExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Differentiator - 符号求导器
 *
 * 递归计算表达式对指定变量的导数,支持:
 * - 常量法则: c' = 0
 * - 变量法则: x' = 1,其他变量视为常量,导数为0
 * - 加法法则: (l + r)' = l' + r'
 * - 乘法法则: (l * r)' = l' * r + l * r'
 * - 幂法则: (b^e)' = e * b^(e + -1) * b'
 *
 * 每个节点先用 {@link Simplifier} 化简直接子节点,再应用求导规则,
 * 中间树更小,原始导数也更易读。返回结果本身不化简,需要时调用方自己调用 simplify。
 *
 * 幂法则只在指数不含求导变量时正确: 没有 ln(b) * e' 这一项。
 *
 * 使用示例:
 * <pre>
 * Expression x = Expressions.variable("x");
 * Expression derivative = differentiator.differentiate(Expressions.mul(x, x), "x");
 * // derivative = ((1 * x) + (x * 1))
 * // simplifier.simplify(derivative) = (x + x)
 * </pre>
 */
public class Differentiator {

    private static final Logger logger = LoggerFactory.getLogger(Differentiator.class);

    /** 默认求导变量 */
    public static final String DEFAULT_VARIABLE = VariableExpression.DEFAULT_NAME;

    /** 用于预先化简子节点 */
    private final Simplifier simplifier;

    /** 未指定变量时使用的求导变量 */
    private final String defaultVariable;

    public Differentiator() {
        this(new Simplifier(), DEFAULT_VARIABLE);
    }

    public Differentiator(Simplifier simplifier) {
        this(simplifier, DEFAULT_VARIABLE);
    }

    public Differentiator(Simplifier simplifier, String defaultVariable) {
        if (simplifier == null) {
            throw new IllegalArgumentException("Simplifier cannot be null");
        }
        if (defaultVariable == null) {
            throw new IllegalArgumentException("Default variable cannot be null");
        }
        this.simplifier = simplifier;
        this.defaultVariable = defaultVariable;
    }

    public String getDefaultVariable() {
        return defaultVariable;
    }

    /**
     * 对默认变量求导
     *
     * @param expr 表达式
     * @return 未化简的导数
     */
    public Expression differentiate(Expression expr) {
        return differentiate(expr, defaultVariable);
    }

    /**
     * 对指定变量求导
     *
     * @param expr 表达式
     * @param variable 求导变量名
     * @return 未化简的导数
     * @throws IllegalArgumentException 表达式或变量名为null
     */
    public Expression differentiate(Expression expr, String variable) {
        if (expr == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        if (variable == null) {
            throw new IllegalArgumentException("Variable cannot be null");
        }

        Expression result = derive(expr, variable);
        if (logger.isDebugEnabled()) {
            logger.debug("d/d{} {} => {}", variable, expr, result);
        }
        return result;
    }

    private Expression derive(Expression expr, String variable) {
        switch (expr.getType()) {
            case CONSTANT:
                return zero();

            case VARIABLE:
                return deriveVariable((VariableExpression) expr, variable);

            case ADD:
                return deriveAdd((AddExpression) expr, variable);

            case MULTIPLY:
                return deriveMultiply((MultiplyExpression) expr, variable);

            case POWER:
                return derivePower((PowerExpression) expr, variable);

            default:
                throw new UnsupportedExpressionException(expr.getType());
        }
    }

    private Expression deriveVariable(VariableExpression expr, String variable) {
        return expr.getName().equals(variable)
                ? new ConstantExpression(NumericValue.ONE)
                : zero();
    }

    private Expression deriveAdd(AddExpression expr, String variable) {
        Expression left = simplifier.simplify(expr.getLeft());
        Expression right = simplifier.simplify(expr.getRight());

        return new AddExpression(derive(left, variable), derive(right, variable));
    }

    private Expression deriveMultiply(MultiplyExpression expr, String variable) {
        Expression left = simplifier.simplify(expr.getLeft());
        Expression right = simplifier.simplify(expr.getRight());

        return new AddExpression(
                new MultiplyExpression(derive(left, variable), right),
                new MultiplyExpression(left, derive(right, variable))
        );
    }

    private Expression derivePower(PowerExpression expr, String variable) {
        Expression base = simplifier.simplify(expr.getBase());
        Expression exponent = simplifier.simplify(expr.getExponent());

        Expression reducedPower = new PowerExpression(
                base, new AddExpression(exponent, new ConstantExpression(NumericValue.MINUS_ONE)));

        return new MultiplyExpression(
                new MultiplyExpression(exponent, reducedPower),
                derive(base, variable)
        );
    }

    private static Expression zero() {
        return new ConstantExpression(NumericValue.ZERO);
    }
}
