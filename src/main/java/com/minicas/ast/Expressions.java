package com.minicas.ast;

import com.minicas.ast.expressions.AddExpression;
import com.minicas.ast.expressions.ConstantExpression;
import com.minicas.ast.expressions.MultiplyExpression;
import com.minicas.ast.expressions.NumericValue;
import com.minicas.ast.expressions.PowerExpression;
import com.minicas.ast.expressions.VariableExpression;

import java.util.Locale;

/**
 * Expressions - 表达式构造工具
 *
 * 提供构造表达式树的静态方法,左右操作数都可以是Expression或数值字面量:
 * <pre>
 * Expression x = variable("x");
 * Expression f = add(add(mul(3, pow(x, 2)), mul(2, x)), 1);   // 3x^2 + 2x + 1
 * Expression g = sub(1, x);                                     // (1 + (-1 * x))
 * </pre>
 *
 * 数值字面量在构造边界通过 {@link #toExpression(Object)} 一次性转换为常量节点。
 *
 * 设计原则:
 * - 没有减法节点: a - b 构造为 Add(a, Multiply(Constant(-1), b))
 * - 只在这里实现构造规则,{@link Expression} 上的 plus/minus/times/pow 都委托到这里
 */
public final class Expressions {

    private Expressions() {
    }

    public static ConstantExpression constant(Number value) {
        return (ConstantExpression) toExpression(value);
    }

    /**
     * 创建默认变量 x
     */
    public static VariableExpression variable() {
        return new VariableExpression();
    }

    public static VariableExpression variable(String name) {
        return new VariableExpression(name);
    }

    // ==================== 加法 ====================

    public static Expression add(Expression left, Expression right) {
        return new AddExpression(requireOperand(left), requireOperand(right));
    }

    public static Expression add(Expression left, Number right) {
        return add(left, toExpression(right));
    }

    public static Expression add(Number left, Expression right) {
        return add(toExpression(left), right);
    }

    // ==================== 减法 ====================

    /**
     * 减法: a - b = a + (-1 * b)
     */
    public static Expression sub(Expression left, Expression right) {
        return add(left, mul(new ConstantExpression(NumericValue.MINUS_ONE), right));
    }

    public static Expression sub(Expression left, Number right) {
        return sub(left, toExpression(right));
    }

    public static Expression sub(Number left, Expression right) {
        return sub(toExpression(left), right);
    }

    // ==================== 乘法 ====================

    public static Expression mul(Expression left, Expression right) {
        return new MultiplyExpression(requireOperand(left), requireOperand(right));
    }

    public static Expression mul(Expression left, Number right) {
        return mul(left, toExpression(right));
    }

    public static Expression mul(Number left, Expression right) {
        return mul(toExpression(left), right);
    }

    // ==================== 幂运算 ====================

    public static Expression pow(Expression base, Expression exponent) {
        return new PowerExpression(requireOperand(base), requireOperand(exponent));
    }

    public static Expression pow(Expression base, Number exponent) {
        return pow(base, toExpression(exponent));
    }

    public static Expression pow(Number base, Expression exponent) {
        return pow(toExpression(base), exponent);
    }

    // ==================== 转换与渲染 ====================

    /**
     * 将操作数转换为表达式
     *
     * @param value Expression原样返回,Number转换为常量
     * @return 表达式
     * @throws CoercionException 操作数为null或无法转换为数值常量
     */
    public static Expression toExpression(Object value) {
        if (value instanceof Expression) {
            return (Expression) value;
        }
        if (value instanceof Number) {
            try {
                return new ConstantExpression(NumericValue.of((Number) value));
            } catch (IllegalArgumentException e) {
                throw new CoercionException("Cannot coerce to constant: " + value, e);
            }
        }
        if (value == null) {
            throw new CoercionException("Cannot coerce null to an expression");
        }
        throw new CoercionException(
                "Cannot coerce " + value.getClass().getSimpleName() + " to an expression: " + value);
    }

    /**
     * 渲染为完全加括号的文本
     *
     * @param expr 表达式
     * @return 如 "((3 * (x^2)) + 1)"
     */
    public static String toText(Expression expr) {
        return String.valueOf(requireOperand(expr));
    }

    /**
     * 渲染为带节点类型的调试文本
     *
     * @param expr 表达式
     * @return 如 "Add: (x + 1)"
     */
    public static String describe(Expression expr) {
        String typeName = requireOperand(expr).getType().name();
        return typeName.charAt(0) + typeName.substring(1).toLowerCase(Locale.ROOT) + ": " + expr;
    }

    private static Expression requireOperand(Expression expr) {
        if (expr == null) {
            throw new CoercionException("Cannot coerce null to an expression");
        }
        return expr;
    }
}
