package com.pmo.portfolio.query;

/**
 * 层级，决定附加哪种过滤条件
 */
public enum HierarchyLevel {

    /** 最外层：结构性字面量过滤，无绑定参数 */
    PORTFOLIO(null),
    PROGRAM("portfolio_id"),
    SUB_PROGRAM("program_id"),
    REGION("region");

    private final String requiredContextKey;

    HierarchyLevel(String requiredContextKey) {
        this.requiredContextKey = requiredContextKey;
    }

    /**
     * 该层级必填的上下文参数名，同时作为绑定参数名；PORTFOLIO 为 null
     */
    public String requiredContextKey() {
        return requiredContextKey;
    }
}
