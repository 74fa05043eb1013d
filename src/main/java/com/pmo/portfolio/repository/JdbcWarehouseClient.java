package com.pmo.portfolio.repository;

import com.pmo.portfolio.exception.WarehouseConnectionException;
import com.pmo.portfolio.exception.WarehouseException;
import com.pmo.portfolio.exception.WarehouseQueryException;
import com.pmo.portfolio.exception.WarehouseTimeoutException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 基于 JDBC 的 Databricks SQL 客户端
 * 查询超时由 JdbcTemplate 统一设置；异常翻译为连接/超时/查询三类，不做重试
 * 异常消息中不出现绑定参数值
 */
@Repository
public class JdbcWarehouseClient implements WarehouseClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcWarehouseClient.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final Timer queryTimer;

    public JdbcWarehouseClient(NamedParameterJdbcTemplate warehouseJdbcTemplate, MeterRegistry meterRegistry) {
        this.jdbcTemplate = warehouseJdbcTemplate;
        this.queryTimer = Timer.builder("warehouse.query.latency")
            .description("Warehouse query latency")
            .register(meterRegistry);
    }

    @Override
    public List<Map<String, Object>> execute(String sql, Map<String, ?> params) {
        long start = System.nanoTime();
        try {
            log.debug("Executing warehouse query with {} bound parameters:\n{}", params.size(), sql);
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, params);
            log.info("Warehouse query returned {} rows in {}ms",
                rows.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return rows;
        } catch (QueryTimeoutException e) {
            throw new WarehouseTimeoutException("Warehouse query timed out", e);
        } catch (DataAccessResourceFailureException e) {
            throw new WarehouseConnectionException("Failed to connect to warehouse", e);
        } catch (DataAccessException e) {
            throw new WarehouseQueryException("Warehouse query failed", e);
        } finally {
            queryTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }
    }

    @Override
    public boolean testConnection() {
        try {
            List<Map<String, Object>> rows = execute("SELECT 1 AS test", Map.of());
            return rows.size() == 1;
        } catch (WarehouseException e) {
            log.error("Warehouse connection test failed: {}", e.getMessage(), e);
            return false;
        }
    }
}
