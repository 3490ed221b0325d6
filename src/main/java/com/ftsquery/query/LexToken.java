package com.ftsquery.query;

public record LexToken(TokenType type, String value, int position) {

    /**
     * 是否为可用作短语文本或列名的字符串 token（裸词或带引号）。
     */
    public boolean isString() {
        return type == TokenType.STRING || type == TokenType.QUOTED_STRING;
    }
}

enum TokenType {
    OR,
    AND,
    NOT,
    NEAR,
    STRING,
    QUOTED_STRING,
    COLON,
    MINUS,
    LCP,
    RCP,
    LP,
    RP,
    CARET,
    COMMA,
    PLUS,
    STAR,
    EOF
}
