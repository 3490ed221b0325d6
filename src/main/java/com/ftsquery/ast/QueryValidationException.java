package com.ftsquery.ast;

/**
 * AST 构造或字典反序列化时违反结构约束。
 */
public class QueryValidationException extends RuntimeException {

    public QueryValidationException(String message) {
        super(message);
    }

    public QueryValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
