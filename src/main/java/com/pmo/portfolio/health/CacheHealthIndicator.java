package com.pmo.portfolio.health;

import com.pmo.portfolio.service.DurableTierCacheService;
import com.pmo.portfolio.service.FastTierCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * 分层缓存健康检查
 * 快速层不可用只标记 degraded，持久层出错才报 DOWN
 */
@Slf4j
@Component("cacheHealthIndicator")
@RequiredArgsConstructor
public class CacheHealthIndicator implements HealthIndicator {

    private final FastTierCacheService fastTierCacheService;
    private final DurableTierCacheService durableTierCacheService;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        boolean fastUp = fastTierCacheService.isAvailable();
        details.put("fast_tier_redis", fastUp ? "UP" : "DOWN");
        details.put("degraded", !fastUp);

        try {
            details.put("durable_entries", durableTierCacheService.size());
            details.put("durable_tier_disk", "UP");
        } catch (RuntimeException e) {
            log.error("Durable tier health check failed", e);
            details.put("durable_tier_disk", "DOWN");
            details.put("durable_error", e.getMessage());
            return Health.down().withDetails(details).build();
        }

        return Health.up().withDetails(details).build();
    }
}
