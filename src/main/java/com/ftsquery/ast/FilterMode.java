package com.ftsquery.ast;

public enum FilterMode {
    INCLUDE("include"),
    EXCLUDE("exclude");

    private final String wireName;

    FilterMode(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 字典与 JSON 表示中使用的名称。
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 按字典名称解析过滤模式，未知名称抛出校验异常。
     */
    public static FilterMode fromWireName(Object value) {
        for (FilterMode mode : values()) {
            if (mode.wireName.equals(value)) {
                return mode;
            }
        }
        throw new QueryValidationException("filter 必须是 'include' 或 'exclude'，实际为: " + value);
    }
}
