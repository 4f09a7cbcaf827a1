package com.minicas.ast.expressions;

/**
 * Operator - 二元运算符
 *
 * 定义表达式语言支持的二元运算符及其渲染方式。
 * 减法不是独立的运算符: a - b 表示为 a + (-1 * b)。
 */
public enum Operator {

    /** 加法 */
    ADD("+", " + "),
    /** 乘法 */
    MULTIPLY("*", " * "),
    /** 幂运算(渲染时两侧不加空格) */
    POWER("^", "^");

    /** 运算符符号 */
    private final String symbol;

    /** 渲染时左右操作数之间的分隔串 */
    private final String separator;

    Operator(String symbol, String separator) {
        this.symbol = symbol;
        this.separator = separator;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getSeparator() {
        return separator;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
