package com.ftsquery.tree;

/**
 * 要定位的节点不在给定查询树中。
 */
public class QueryLookupException extends RuntimeException {

    public QueryLookupException(String message) {
        super(message);
    }
}
