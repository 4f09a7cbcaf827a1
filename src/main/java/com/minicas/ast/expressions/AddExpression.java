package com.minicas.ast.expressions;

import com.minicas.ast.Expression;

/**
 * AddExpression - 加法表达式
 */
public class AddExpression extends BinaryExpression {

    public AddExpression(Expression left, Expression right) {
        super(left, right);
    }

    @Override
    public Operator getOperator() {
        return Operator.ADD;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.ADD;
    }
}
