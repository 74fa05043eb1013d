package com.pmo.portfolio.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmo.portfolio.config.CacheProperties;
import com.pmo.portfolio.config.JacksonConfig;
import com.pmo.portfolio.constant.CacheConstants;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * 快速层缓存服务（Redis）
 * <p>
 * 可选层：启动时 ping 不通或配置关闭即视为不可用，所有操作直接返回未命中/失败。
 * 运行期异常只记日志，不向上抛出；连续失败由熔断器短路
 */
@Service
public class FastTierCacheService {

    private static final Logger log = LoggerFactory.getLogger(FastTierCacheService.class);

    private static final String PONG = "PONG";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final CacheProperties.FastTierConfig config;

    private volatile boolean available;

    public FastTierCacheService(StringRedisTemplate redisTemplate,
                                ObjectMapper objectMapper,
                                CircuitBreaker fastTierCircuitBreaker,
                                CacheProperties cacheProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = JacksonConfig.exactDecimals(objectMapper);
        this.circuitBreaker = fastTierCircuitBreaker;
        this.config = cacheProperties.getFast();
    }

    /**
     * 探测 Redis 连通性
     *
     * @return 是否可用
     */
    public boolean connect() {
        if (!config.isEnabled()) {
            available = false;
            log.info("Fast tier disabled by configuration, using durable tier only");
            return false;
        }
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            available = PONG.equalsIgnoreCase(reply);
        } catch (RuntimeException e) {
            available = false;
            log.warn("Redis not available at {}:{}: {}. Falling back to durable tier",
                config.getHost(), config.getPort(), e.getMessage());
            return false;
        }
        if (available) {
            log.info("Connected to Redis at {}:{}", config.getHost(), config.getPort());
        } else {
            log.warn("Unexpected Redis ping reply, fast tier disabled");
        }
        return available;
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * 读取缓存
     */
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        if (!available) {
            return Optional.empty();
        }
        try {
            String json = circuitBreaker.executeSupplier(() -> redisTemplate.opsForValue().get(key));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (CallNotPermittedException e) {
            log.debug("Fast tier circuit open, skip get: {}", key);
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Fast tier entry unreadable, key: {}", key, e);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Redis get error, key: {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * 写入缓存，TTL 精确生效
     *
     * @return 是否写入成功
     */
    public boolean set(String key, Object value, Duration ttl) {
        if (!available || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Value not serializable for fast tier, key: {}", key, e);
            return false;
        }
        try {
            circuitBreaker.executeRunnable(() -> redisTemplate.opsForValue().set(key, json, ttl));
            return true;
        } catch (CallNotPermittedException e) {
            log.debug("Fast tier circuit open, skip set: {}", key);
            return false;
        } catch (RuntimeException e) {
            log.error("Redis set error, key: {}", key, e);
            return false;
        }
    }

    /**
     * 删除 Key 中包含 pattern 子串的条目
     * pattern 中的 glob 元字符按字面量处理
     */
    public boolean deleteMatching(String pattern) {
        return deleteByGlob("*" + escapeGlob(pattern) + "*");
    }

    /**
     * 清空本服务写入的全部条目（只删命名空间前缀下的 Key）
     */
    public boolean clearAll() {
        return deleteByGlob(CacheConstants.QUERY_KEY_PREFIX + "*");
    }

    /**
     * 当前库 Key 数量，不可用时返回 null
     */
    public Long keyCount() {
        if (!available) {
            return null;
        }
        try {
            return circuitBreaker.executeSupplier(() ->
                redisTemplate.execute((RedisCallback<Long>) connection -> connection.serverCommands().dbSize()));
        } catch (CallNotPermittedException e) {
            log.debug("Fast tier circuit open, skip dbSize");
            return null;
        } catch (RuntimeException e) {
            log.warn("Redis dbSize error: {}", e.getMessage());
            return null;
        }
    }

    /**
     * 已用内存（人类可读），不可用时返回 null
     */
    public String usedMemory() {
        if (!available) {
            return null;
        }
        try {
            Properties info = circuitBreaker.executeSupplier(() -> redisTemplate.execute(
                (RedisCallback<Properties>) connection -> connection.serverCommands().info("memory")));
            return info == null ? null : info.getProperty("used_memory_human");
        } catch (CallNotPermittedException e) {
            log.debug("Fast tier circuit open, skip info");
            return null;
        } catch (RuntimeException e) {
            log.warn("Redis info error: {}", e.getMessage());
            return null;
        }
    }

    private boolean deleteByGlob(String glob) {
        if (!available) {
            return false;
        }
        try {
            Set<String> keys = circuitBreaker.executeSupplier(() -> redisTemplate.keys(glob));
            if (keys == null || keys.isEmpty()) {
                return true;
            }
            Long deleted = circuitBreaker.executeSupplier(() -> redisTemplate.delete(keys));
            log.info("Fast tier deleted {} keys matching {}", deleted, glob);
            return true;
        } catch (RuntimeException e) {
            log.error("Redis delete error, pattern: {}", glob, e);
            return false;
        }
    }

    static String escapeGlob(String pattern) {
        StringBuilder escaped = new StringBuilder(pattern.length());
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
