package com.ftsquery.config;

/**
 * 查询前端运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class QueryConfig {
    private int maxQueryLength = Constants.MAX_QUERY_LENGTH;
    private int maxNestingDepth = Constants.MAX_NESTING_DEPTH;
    
    public int getMaxQueryLength() {
        return maxQueryLength;
    }
    
    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }
    
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }
    
    public void setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static QueryConfig defaults() {
        return new QueryConfig();
    }
}
