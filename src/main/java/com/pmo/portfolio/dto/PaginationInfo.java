package com.pmo.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pmo.portfolio.query.PageRequest;

/**
 * 分页信息
 * <p>
 * hasMore 为近似值：结果条数等于 limit 即认为还有下一页。
 * 总数恰好是 limit 整数倍时，调用方会多请求一次空页；为避免每页额外的 COUNT 查询，不做修正。
 */
public record PaginationInfo(
    int page,
    int limit,
    @JsonProperty("total_items") int totalItems,
    @JsonProperty("has_more") boolean hasMore
) {

    public static PaginationInfo envelope(int rowCount, PageRequest pageRequest) {
        return new PaginationInfo(
            pageRequest.page(),
            pageRequest.limit(),
            rowCount,
            rowCount == pageRequest.limit()
        );
    }
}
