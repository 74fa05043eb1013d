package com.pmo.portfolio.dto;

/**
 * 本次响应中各数据集是否来自缓存
 */
public record CacheInfo(boolean hierarchyCached, boolean investmentCached) {

    public boolean cached() {
        return hierarchyCached && investmentCached;
    }
}
