package com.pmo.portfolio.service;

/**
 * 分层缓存查询结果，标明数据来源
 * <p>
 * getOrLoad 返回时 MISS 表示值由加载器新查出
 */
public record CacheLookup<T>(Source source, T value) {

    public enum Source {
        HIT_FAST,
        HIT_DURABLE,
        MISS
    }

    public static <T> CacheLookup<T> fastHit(T value) {
        return new CacheLookup<>(Source.HIT_FAST, value);
    }

    public static <T> CacheLookup<T> durableHit(T value) {
        return new CacheLookup<>(Source.HIT_DURABLE, value);
    }

    public static <T> CacheLookup<T> miss() {
        return new CacheLookup<>(Source.MISS, null);
    }

    public static <T> CacheLookup<T> loaded(T value) {
        return new CacheLookup<>(Source.MISS, value);
    }

    public boolean isHit() {
        return source != Source.MISS;
    }
}
