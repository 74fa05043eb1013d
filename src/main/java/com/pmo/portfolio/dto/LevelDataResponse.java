package com.pmo.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 层级查询结果：层级数据 + 投资数据 + 分页信息
 */
public record LevelDataResponse(
    List<Map<String, Object>> hierarchy,
    List<Map<String, Object>> investment,
    PaginationInfo pagination,
    @JsonProperty("cache_info") CacheInfo cacheInfo
) {
}
