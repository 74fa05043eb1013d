package com.pmo.portfolio.query;

import java.util.Objects;

/**
 * 启动时加载的原始 SQL 模板，不可变
 */
public record QueryTemplate(String name, String sql) {

    public QueryTemplate {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sql, "sql");
    }
}
