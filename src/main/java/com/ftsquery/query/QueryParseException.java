package com.ftsquery.query;

public class QueryParseException extends RuntimeException {
    private final int position;
    private final String queryString;
    private final String reason;
    private final String suggestion;

    public QueryParseException(String message, int position, String queryString) {
        super(buildMessage(message, position, queryString == null ? "" : queryString));
        this.position = position;
        this.queryString = queryString == null ? "" : queryString;
        this.reason = message;
        this.suggestion = suggestFix(message, position, this.queryString);
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    /**
     * 不含位置与原文的错误描述。
     */
    public String getReason() {
        return reason;
    }

    public String getSuggestion() {
        return suggestion;
    }

    private static String buildMessage(String message, int pos, String query) {
        int caretPos = Math.max(0, Math.min(pos, query.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return "Parse error at position " + pos + ": " + message + System.lineSeparator()
                + query + System.lineSeparator() + pointer;
    }

    private static String suggestFix(String message, int pos, String query) {
        if (query.isBlank()) {
            return "请输入非空查询";
        }
        if (query.chars().filter(ch -> ch == '"').count() % 2 != 0) {
            return "检测到未闭合引号，请补全右引号";
        }
        if (message != null && message.contains("NEAR")) {
            return "NEAR 写法为 NEAR(短语 短语 [, 距离])，至少两个短语，距离为未加引号的正整数";
        }
        if (message != null && (message.contains("列") || message.contains("冒号"))) {
            return "列过滤器写法为 列名: 查询、{列1 列2}: 查询 或 -列名: 查询";
        }
        if (pos < query.length() && query.charAt(pos) == '(' || pos >= query.length() && query.indexOf('(') >= 0) {
            return "请检查括号是否成对出现";
        }
        return "请检查该位置附近的语法，例如括号、引号、短语标记 ^ + * 或布尔运算符";
    }
}
