package com.pmo.portfolio.repository;

import com.pmo.portfolio.exception.WarehouseConnectionException;
import com.pmo.portfolio.exception.WarehouseQueryException;
import com.pmo.portfolio.exception.WarehouseTimeoutException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * 数仓客户端异常映射测试
 */
@ExtendWith(MockitoExtension.class)
class JdbcWarehouseClientTest {

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    private SimpleMeterRegistry meterRegistry;
    private JdbcWarehouseClient client;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        client = new JdbcWarehouseClient(jdbcTemplate, meterRegistry);
    }

    @Test
    @DisplayName("查询成功 - 返回行并记录耗时")
    void testExecute_success() {
        Map<String, Object> params = Map.of("portfolio_id", "PTF1");
        when(jdbcTemplate.queryForList("SELECT 1", params)).thenReturn(List.of(Map.of("CHILD_ID", "P1")));

        List<Map<String, Object>> rows = client.execute("SELECT 1", params);

        assertEquals(1, rows.size());
        assertEquals(1, meterRegistry.get("warehouse.query.latency").timer().count());
    }

    @Test
    @DisplayName("超时 - WarehouseTimeoutException")
    void testExecute_timeout() {
        when(jdbcTemplate.queryForList(anyString(), anyMap())).thenThrow(new QueryTimeoutException("timeout"));

        assertThrows(WarehouseTimeoutException.class, () -> client.execute("SELECT 1", Map.of()));
    }

    @Test
    @DisplayName("无法获取连接 - WarehouseConnectionException")
    void testExecute_connectionFailure() {
        when(jdbcTemplate.queryForList(anyString(), anyMap()))
            .thenThrow(new CannotGetJdbcConnectionException("refused"));

        assertThrows(WarehouseConnectionException.class, () -> client.execute("SELECT 1", Map.of()));
    }

    @Test
    @DisplayName("SQL 错误 - WarehouseQueryException")
    void testExecute_badSql() {
        when(jdbcTemplate.queryForList(anyString(), anyMap()))
            .thenThrow(new BadSqlGrammarException("query", "SELECT", new SQLException("syntax")));

        assertThrows(WarehouseQueryException.class, () -> client.execute("SELECT", Map.of()));
    }

    @Test
    @DisplayName("连通性测试失败返回 false")
    void testTestConnection_failure() {
        when(jdbcTemplate.queryForList(anyString(), anyMap()))
            .thenThrow(new CannotGetJdbcConnectionException("refused"));

        assertFalse(client.testConnection());
    }
}
