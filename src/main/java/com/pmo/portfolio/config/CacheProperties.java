package com.pmo.portfolio.config;

import com.pmo.portfolio.constant.CacheConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 缓存配置属性类
 */
@Data
@Component
@ConfigurationProperties(prefix = "pmo.cache")
public class CacheProperties {

    /** 默认过期时间（秒） */
    private long defaultTtlSeconds = CacheConstants.DEFAULT_TTL_SECONDS;

    /** 快速层（Redis）配置 */
    private FastTierConfig fast = new FastTierConfig();

    /** 持久层（本地磁盘）配置 */
    private DurableTierConfig durable = new DurableTierConfig();

    @Data
    public static class FastTierConfig {
        /** 是否启用快速层 */
        private boolean enabled = true;
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;
        /** 连接超时（毫秒），不超过 2 秒 */
        private long connectTimeoutMillis = 2000;
        /** 命令超时（毫秒） */
        private long commandTimeoutMillis = 2000;
    }

    @Data
    public static class DurableTierConfig {
        /** 缓存目录 */
        private String directory = "cache";
        /** 容量上限（字节），默认 500MB */
        private long maxBytes = 500_000_000L;
    }
}
