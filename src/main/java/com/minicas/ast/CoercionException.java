package com.minicas.ast;

/**
 * CoercionException - 操作数转换异常
 *
 * 构造表达式时,操作数既不是Expression也不是支持的数值类型时抛出此异常。
 */
public class CoercionException extends RuntimeException {

    public CoercionException(String message) {
        super(message);
    }

    public CoercionException(String message, Throwable cause) {
        super(message, cause);
    }
}
