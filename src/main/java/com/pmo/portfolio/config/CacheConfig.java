package com.pmo.portfolio.config;

import com.pmo.portfolio.constant.CacheConstants;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * 缓存基础设施配置
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    // 熔断器配置
    private static final float FAILURE_RATE_THRESHOLD = 50.0f;
    private static final int MINIMUM_CALLS = 10;
    private static final int SLIDING_WINDOW_SIZE = 20;
    private static final Duration WAIT_DURATION_IN_OPEN_STATE = Duration.ofSeconds(30);

    /**
     * 持久层 TTL 判断使用的时钟
     */
    @Bean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    /**
     * 快速层熔断器：Redis 连续失败时直接跳过，不再逐次等待超时
     */
    @Bean
    public CircuitBreaker fastTierCircuitBreaker() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(FAILURE_RATE_THRESHOLD)
            .minimumNumberOfCalls(MINIMUM_CALLS)
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(SLIDING_WINDOW_SIZE)
            .waitDurationInOpenState(WAIT_DURATION_IN_OPEN_STATE)
            .permittedNumberOfCallsInHalfOpenState(3)
            .build();

        CircuitBreaker circuitBreaker = CircuitBreakerRegistry.of(config)
            .circuitBreaker(CacheConstants.FAST_TIER_BREAKER);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Fast tier circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()));

        return circuitBreaker;
    }
}
