package com.pmo.portfolio.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis 快速层配置
 * 单机模式，连接/命令超时均不超过 2 秒，断连期间直接拒绝命令，避免请求链路被缓存层拖慢
 */
@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    /**
     * Lettuce 客户端资源配置
     */
    @Bean(destroyMethod = "shutdown")
    public ClientResources clientResources() {
        return DefaultClientResources.builder()
            .ioThreadPoolSize(2)
            .computationThreadPoolSize(2)
            .build();
    }

    /**
     * Lettuce 客户端配置
     */
    @Bean
    public LettuceClientConfiguration lettuceClientConfiguration(ClientResources clientResources,
                                                                 CacheProperties cacheProperties) {
        CacheProperties.FastTierConfig fast = cacheProperties.getFast();
        Duration connectTimeout = Duration.ofMillis(fast.getConnectTimeoutMillis());
        Duration commandTimeout = Duration.ofMillis(fast.getCommandTimeoutMillis());

        ClientOptions clientOptions = ClientOptions.builder()
            .socketOptions(SocketOptions.builder().connectTimeout(connectTimeout).build())
            .timeoutOptions(TimeoutOptions.enabled(commandTimeout))
            // 断连时不排队，立即失败后回落到持久层
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .autoReconnect(true)
            .build();

        return LettuceClientConfiguration.builder()
            .clientResources(clientResources)
            .clientOptions(clientOptions)
            .commandTimeout(commandTimeout)
            .build();
    }

    /**
     * Redis 连接工厂（懒连接，启动时 Redis 不可用不影响服务启动）
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(LettuceClientConfiguration lettuceClientConfiguration,
                                                           CacheProperties cacheProperties) {
        CacheProperties.FastTierConfig fast = cacheProperties.getFast();
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(fast.getHost(), fast.getPort());
        standalone.setDatabase(fast.getDatabase());

        if (fast.getPassword() != null && !fast.getPassword().isEmpty()) {
            standalone.setPassword(fast.getPassword());
        }

        log.info("Redis fast tier configured: {}:{}/{}", fast.getHost(), fast.getPort(), fast.getDatabase());

        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, lettuceClientConfiguration);
        factory.setValidateConnection(false);
        return factory;
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        return template;
    }
}
