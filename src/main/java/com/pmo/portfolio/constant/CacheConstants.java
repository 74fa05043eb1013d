package com.pmo.portfolio.constant;

/**
 * 缓存相关常量
 */
public final class CacheConstants {

    private CacheConstants() {}

    // ==================== Key ====================

    /** 查询缓存 Key 命名空间前缀 */
    public static final String QUERY_KEY_PREFIX = "pmo_query_";

    /** 持久层条目文件后缀 */
    public static final String DURABLE_FILE_SUFFIX = ".json";

    // ==================== TTL ====================

    /** 层级/投资查询默认 TTL（秒） */
    public static final long DEFAULT_TTL_SECONDS = 300;

    /** 区域筛选项 TTL（秒），变化很慢 */
    public static final long FILTER_OPTIONS_TTL_SECONDS = 1800;

    // ==================== 熔断器 ====================

    /** 快速层熔断器名称 */
    public static final String FAST_TIER_BREAKER = "fastTier";

    // ==================== 分页 ====================

    /** 单页上限 */
    public static final int MAX_PAGE_LIMIT = 50;
}
