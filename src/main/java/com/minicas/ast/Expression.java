package com.minicas.ast;

/**
 * Expression - 代数表达式接口
 *
 * 表示符号微分系统中的各种表达式,包括:
 * - 常量: 3, -1, 0.5
 * - 变量: x, y
 * - 加法: (x + 1)
 * - 乘法: (3 * x)
 * - 幂运算: (x^2)
 *
 * 设计原则:
 * - "Good taste": 所有节点都是Expression,引擎按类型分发,没有特殊情况
 * - 不可变: 任何变换都产生新的树,不修改已有节点
 * - 封闭集合: 只有五种节点,引擎对每一种都有规则
 *
 * 使用示例:
 * <pre>
 * Expression x = Expressions.variable("x");
 * Expression f = Expressions.mul(3, x.pow(2)).plus(Expressions.mul(2, x)).plus(1);
 * // f.toString() = "(((3 * (x^2)) + (2 * x)) + 1)"
 * </pre>
 *
 * 下面的默认方法只是语法糖,全部委托给 {@link Expressions}。
 */
public interface Expression {

    /**
     * 获取表达式类型
     *
     * @return 表达式类型枚举
     */
    ExpressionType getType();

    default Expression plus(Expression other) {
        return Expressions.add(this, other);
    }

    default Expression plus(Number other) {
        return Expressions.add(this, other);
    }

    default Expression minus(Expression other) {
        return Expressions.sub(this, other);
    }

    default Expression minus(Number other) {
        return Expressions.sub(this, other);
    }

    default Expression times(Expression other) {
        return Expressions.mul(this, other);
    }

    default Expression times(Number other) {
        return Expressions.mul(this, other);
    }

    default Expression pow(Expression exponent) {
        return Expressions.pow(this, exponent);
    }

    default Expression pow(Number exponent) {
        return Expressions.pow(this, exponent);
    }

    /**
     * 表达式类型枚举
     */
    enum ExpressionType {
        /** 常量 */
        CONSTANT,
        /** 变量 */
        VARIABLE,
        /** 加法 */
        ADD,
        /** 乘法 */
        MULTIPLY,
        /** 幂运算 */
        POWER
    }
}
