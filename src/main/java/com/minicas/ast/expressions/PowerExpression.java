package com.minicas.ast.expressions;

import com.minicas.ast.Expression;

/**
 * PowerExpression - 幂运算表达式
 *
 * 左操作数为底数,右操作数为指数。渲染为 (B^E)。
 */
public class PowerExpression extends BinaryExpression {

    public PowerExpression(Expression base, Expression exponent) {
        super(base, exponent);
    }

    /**
     * 获取底数
     */
    public Expression getBase() {
        return getLeft();
    }

    /**
     * 获取指数
     */
    public Expression getExponent() {
        return getRight();
    }

    @Override
    public Operator getOperator() {
        return Operator.POWER;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.POWER;
    }
}
