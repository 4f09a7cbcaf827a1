package com.minicas.ast.expressions;

import com.minicas.ast.Expression;

/**
 * VariableExpression - 变量表达式
 *
 * 表示绑定到名字的符号,如 x, y, time。
 * 对其他变量求导时被当作常量处理。
 */
public class VariableExpression implements Expression {

    /** 默认变量名 */
    public static final String DEFAULT_NAME = "x";

    /** 变量名 */
    private final String name;

    public VariableExpression() {
        this(DEFAULT_NAME);
    }

    public VariableExpression(String name) {
        if (name == null) {
            throw new NullPointerException("Variable name cannot be null");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.VARIABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariableExpression)) {
            return false;
        }
        return name.equals(((VariableExpression) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
