package com.pmo.portfolio.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 数仓访问配置
 */
@Configuration
public class WarehouseConfig {

    /**
     * 命名参数 JdbcTemplate，查询超时有上限
     */
    @Bean
    public NamedParameterJdbcTemplate warehouseJdbcTemplate(DataSource dataSource, QueryProperties queryProperties) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(queryProperties.getWarehouseTimeoutSeconds());
        jdbcTemplate.setFetchSize(1000);
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    /**
     * Portfolio 层层级查询与投资查询并行执行用的线程池
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService warehouseQueryExecutor(QueryProperties queryProperties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(queryProperties.getParallelFetchThreads(), r -> {
            Thread t = new Thread(r, "warehouse-query-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
