package com.minicas.ast.expressions;

import com.minicas.ast.Expression;

/**
 * BinaryExpression - 二元运算表达式
 *
 * 加法、乘法、幂运算的公共父类,持有左右两个操作数:
 * - 加法: (x + 1)
 * - 乘法: (3 * x)
 * - 幂运算: (x^2)
 *
 * 设计原则:
 * - 不可变对象
 * - 两个操作数都不能为null,没有"缺失子节点"的特殊情况
 * - 渲染总是加括号,不考虑优先级: 输出冗长但没有歧义
 */
public abstract class BinaryExpression implements Expression {

    /** 左操作数 */
    private final Expression left;

    /** 右操作数 */
    private final Expression right;

    protected BinaryExpression(Expression left, Expression right) {
        if (left == null || right == null) {
            throw new NullPointerException(getClass().getSimpleName() + " operands cannot be null");
        }
        this.left = left;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    /**
     * 获取运算符
     *
     * @return 运算符枚举
     */
    public abstract Operator getOperator();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BinaryExpression that = (BinaryExpression) o;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * getOperator().hashCode() + left.hashCode()) + right.hashCode();
    }

    @Override
    public String toString() {
        return "(" + left + getOperator().getSeparator() + right + ")";
    }
}
