package com.ftsquery.config;

/**
 * 全局常量定义
 * 
 * 包含查询语法默认值、解析安全上限和预分词标记编码参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 查询语法默认值 ====================
    /** NEAR 默认最大间隔（token 数） */
    public static final int DEFAULT_NEAR_DISTANCE = 10;
    
    // ==================== 解析安全上限 ====================
    /** 查询字符串最大长度（字符数） */
    public static final int MAX_QUERY_LENGTH = 100_000;
    /** 括号、NEAR、列过滤器的最大嵌套深度 */
    public static final int MAX_NESTING_DEPTH = 256;
    
    // ==================== 预分词标记 ====================
    /** 预分词短语的保留前缀 */
    public static final String QUERY_TOKENS_MARKER = "$!Tokens~";
    /** NUL 字符的替代编码 */
    public static final String QUERY_TOKENS_ZERO = "$!ZeRo";
    /** 槽位分隔符 */
    public static final String QUERY_TOKENS_SLOT_SEPARATOR = "|";
    /** 同位（同义）token 分隔符 */
    public static final String QUERY_TOKENS_COLOCATED_SEPARATOR = ">";
    
    // ==================== 字典表示 ====================
    /** 嵌套 Map 中的类型鉴别键 */
    public static final String DICT_TYPE_KEY = "@";
}
