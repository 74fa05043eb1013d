package com.pmo.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RegionFilterOptions(
    List<String> regions,
    @JsonProperty("supply_chains") List<String> supplyChains
) {
}
