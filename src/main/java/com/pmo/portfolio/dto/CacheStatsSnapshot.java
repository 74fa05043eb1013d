package com.pmo.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 缓存统计快照
 * 快速层不可用时 fastTierKeyCount / fastTierMemory 为空
 */
public record CacheStatsSnapshot(
    @JsonProperty("fast_tier_available") boolean fastTierAvailable,
    @JsonProperty("durable_entry_count") long durableEntryCount,
    @JsonProperty("fast_tier_key_count") Long fastTierKeyCount,
    @JsonProperty("fast_tier_memory") String fastTierMemory,
    @JsonProperty("fast_hits") double fastHits,
    @JsonProperty("durable_hits") double durableHits,
    @JsonProperty("misses") double misses
) {
}
