package com.minicas.ast.expressions;

import com.minicas.ast.Expression;

/**
 * ConstantExpression - 常量表达式
 *
 * 表示一个数值字面量,包括:
 * - 整数: 3, -1, 0
 * - 实数: 0.5, 6.0
 *
 * 设计原则:
 * - 不可变对象
 * - 数值统一用 {@link NumericValue} 表示,折叠运算不关心具体的Java类型
 */
public class ConstantExpression implements Expression {

    /** 常量值 */
    private final NumericValue value;

    public ConstantExpression(NumericValue value) {
        if (value == null) {
            throw new NullPointerException("Constant value cannot be null");
        }
        this.value = value;
    }

    public ConstantExpression(long value) {
        this(NumericValue.ofInteger(value));
    }

    public ConstantExpression(double value) {
        this(NumericValue.ofReal(value));
    }

    public NumericValue getValue() {
        return value;
    }

    /**
     * 判断是否为零常量(0 或 0.0)
     */
    public boolean isZero() {
        return value.isZero();
    }

    /**
     * 判断是否为一常量(1 或 1.0)
     */
    public boolean isOne() {
        return value.isOne();
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.CONSTANT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConstantExpression)) {
            return false;
        }
        return value.equals(((ConstantExpression) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
