package com.pmo.portfolio.repository;

import java.util.List;
import java.util.Map;

/**
 * 数仓客户端
 */
public interface WarehouseClient {

    /**
     * 执行参数化查询
     *
     * @param sql    只含命名占位符（:name）的 SQL
     * @param params 绑定参数
     * @return 行列表，列名 → 值
     * @throws com.pmo.portfolio.exception.WarehouseConnectionException 无法连接
     * @throws com.pmo.portfolio.exception.WarehouseTimeoutException    超时
     * @throws com.pmo.portfolio.exception.WarehouseQueryException      查询失败
     */
    List<Map<String, Object>> execute(String sql, Map<String, ?> params);

    /**
     * 连通性探测
     */
    boolean testConnection();
}
