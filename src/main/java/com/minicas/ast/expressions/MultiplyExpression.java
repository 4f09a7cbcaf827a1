package com.minicas.ast.expressions;

import com.minicas.ast.Expression;

/**
 * MultiplyExpression - 乘法表达式
 *
 * 取负也用乘法表示: -x 即 (-1 * x)。
 */
public class MultiplyExpression extends BinaryExpression {

    public MultiplyExpression(Expression left, Expression right) {
        super(left, right);
    }

    @Override
    public Operator getOperator() {
        return Operator.MULTIPLY;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.MULTIPLY;
    }
}
