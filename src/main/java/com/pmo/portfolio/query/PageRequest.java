package com.pmo.portfolio.query;

import com.pmo.portfolio.exception.ValidationException;

/**
 * 分页请求，offset = (page - 1) * limit
 */
public record PageRequest(int page, int limit) {

    public PageRequest {
        if (page < 1) {
            throw new ValidationException("page must be >= 1");
        }
        if (limit < 1) {
            throw new ValidationException("limit must be > 0");
        }
    }

    /**
     * 校验并把 limit 截断到上限
     */
    public static PageRequest of(int page, int limit, int maxLimit) {
        return new PageRequest(page, Math.min(limit, maxLimit));
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }
}
