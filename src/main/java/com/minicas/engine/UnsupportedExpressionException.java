package com.minicas.engine;

import com.minicas.ast.Expression;

/**
 * UnsupportedExpressionException - 不支持的表达式类型
 *
 * 引擎按 {@link Expression.ExpressionType} 分发,遇到没有规则的类型时抛出。
 * 对现有的五种节点不会发生,只有扩展节点类型而没有同步扩展引擎时才会出现。
 */
public class UnsupportedExpressionException extends RuntimeException {

    public UnsupportedExpressionException(String message) {
        super(message);
    }

    public UnsupportedExpressionException(Expression.ExpressionType type) {
        this("Unsupported expression type: " + type);
    }
}
