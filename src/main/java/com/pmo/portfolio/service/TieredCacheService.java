package com.pmo.portfolio.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pmo.portfolio.config.CacheProperties;
import com.pmo.portfolio.dto.CacheStatsSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 分层缓存门面服务
 * 快速层（Redis）→ 持久层（本地磁盘）→ 加载器
 *
 * <ul>
 *   <li>快速层可选，任何失败都降级到持久层，不向调用方抛出</li>
 *   <li>持久层命中后按剩余 TTL 回填快速层</li>
 *   <li>两层独立写入，任一成功即视为写入成功</li>
 * </ul>
 * 并发未命中不合并，各自加载
 */
@Service
public class TieredCacheService {

    private static final Logger log = LoggerFactory.getLogger(TieredCacheService.class);

    private final FastTierCacheService fastTier;
    private final DurableTierCacheService durableTier;
    private final Duration defaultTtl;

    // 性能指标
    private final Counter fastHitCounter;
    private final Counter durableHitCounter;
    private final Counter missCounter;
    private final Timer loadTimer;

    public TieredCacheService(FastTierCacheService fastTier,
                              DurableTierCacheService durableTier,
                              CacheProperties cacheProperties,
                              MeterRegistry meterRegistry) {
        this.fastTier = fastTier;
        this.durableTier = durableTier;
        this.defaultTtl = Duration.ofSeconds(cacheProperties.getDefaultTtlSeconds());

        this.fastHitCounter = Counter.builder("cache.fast.hits").register(meterRegistry);
        this.durableHitCounter = Counter.builder("cache.durable.hits").register(meterRegistry);
        this.missCounter = Counter.builder("cache.misses").register(meterRegistry);
        this.loadTimer = Timer.builder("cache.load.latency").register(meterRegistry);
    }

    /**
     * 持久层总是打开；快速层连不上只记录日志
     */
    @PostConstruct
    public void init() {
        durableTier.open();
        boolean fastAvailable = fastTier.connect();
        log.info("Tiered cache initialized: fastTier={}, durableEntries={}", fastAvailable, durableTier.size());
    }

    @PreDestroy
    public void shutdown() {
        durableTier.close();
        log.info("Tiered cache shut down");
    }

    /**
     * 分层读取
     */
    public <T> CacheLookup<T> get(String key, TypeReference<T> type) {
        Optional<T> fast = fastTier.get(key, type);
        if (fast.isPresent()) {
            fastHitCounter.increment();
            log.debug("Fast tier HIT: {}", key);
            return CacheLookup.fastHit(fast.get());
        }

        Optional<DurableTierCacheService.DurableHit<T>> durable = durableTier.get(key, type);
        if (durable.isPresent()) {
            durableHitCounter.increment();
            DurableTierCacheService.DurableHit<T> hit = durable.get();
            log.debug("Durable tier HIT: {}, remaining {}s", key, hit.remainingTtl().toSeconds());
            if (fastTier.isAvailable()) {
                fastTier.set(key, hit.value(), hit.remainingTtl());
            }
            return CacheLookup.durableHit(hit.value());
        }

        missCounter.increment();
        log.info("Cache MISS: {}", key);
        return CacheLookup.miss();
    }

    public boolean set(String key, Object value) {
        return set(key, value, defaultTtl);
    }

    /**
     * 两层分别写入
     *
     * @return 至少一层写入成功
     */
    public boolean set(String key, Object value, Duration ttl) {
        boolean fastOk = fastTier.set(key, value, ttl);
        boolean durableOk = durableTier.set(key, value, ttl);
        if (!fastOk && !durableOk) {
            log.warn("Cache write failed on both tiers: {}", key);
        } else {
            log.debug("Cache SET: {}, fast={}, durable={}, ttl={}s", key, fastOk, durableOk, ttl.toSeconds());
        }
        return fastOk || durableOk;
    }

    /**
     * 读取，未命中时调用加载器并写回
     * 加载器抛出的异常原样向上传播，不写缓存
     */
    public <T> CacheLookup<T> getOrLoad(String key, TypeReference<T> type, Supplier<T> loader, Duration ttl) {
        CacheLookup<T> lookup = get(key, type);
        if (lookup.isHit()) {
            return lookup;
        }

        T value = loadTimer.record(loader);
        if (value != null) {
            set(key, value, ttl);
        }
        return CacheLookup.loaded(value);
    }

    /**
     * 清理缓存
     *
     * @param pattern 为空时清空两层；否则删除 Key 中包含该子串的条目
     */
    public boolean clear(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            boolean fastOk = !fastTier.isAvailable() || fastTier.clearAll();
            boolean durableOk = durableTier.clear();
            log.info("Cache cleared: fast={}, durable={}", fastOk, durableOk);
            return fastOk && durableOk;
        }

        int durableRemoved = durableTier.deleteMatching(pattern);
        boolean fastOk = !fastTier.isAvailable() || fastTier.deleteMatching(pattern);
        log.info("Cache cleared by pattern '{}': fast={}, durableRemoved={}", pattern, fastOk, durableRemoved);
        return fastOk;
    }

    /**
     * 缓存统计
     */
    public CacheStatsSnapshot stats() {
        return new CacheStatsSnapshot(
            fastTier.isAvailable(),
            durableTier.size(),
            fastTier.keyCount(),
            fastTier.usedMemory(),
            fastHitCounter.count(),
            durableHitCounter.count(),
            missCounter.count()
        );
    }
}
