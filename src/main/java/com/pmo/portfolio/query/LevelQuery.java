package com.pmo.portfolio.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 拼装完成的参数化语句及其命名参数
 */
public record LevelQuery(String sql, Map<String, Object> parameters) {

    public LevelQuery {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
