package com.pmo.portfolio.service;

import com.pmo.portfolio.config.QueryProperties;
import com.pmo.portfolio.constant.CacheConstants;
import com.pmo.portfolio.dto.RegionFilterOptions;
import com.pmo.portfolio.query.LevelQuery;
import com.pmo.portfolio.query.QueryShaper;
import com.pmo.portfolio.repository.QueryTemplateRepository;
import com.pmo.portfolio.repository.WarehouseClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 区域页筛选项：区域、供应链去重取值
 */
@Slf4j
@Service
public class RegionFilterService {

    private static final Duration FILTER_OPTIONS_TTL = Duration.ofSeconds(CacheConstants.FILTER_OPTIONS_TTL_SECONDS);

    private final QueryShaper queryShaper;
    private final QueryTemplateRepository templateRepository;
    private final WarehouseClient warehouseClient;
    private final TieredCacheService tieredCache;
    private final CacheKeyDeriver keyDeriver;
    private final QueryProperties.Columns columns;

    public RegionFilterService(QueryShaper queryShaper,
                               QueryTemplateRepository templateRepository,
                               WarehouseClient warehouseClient,
                               TieredCacheService tieredCache,
                               CacheKeyDeriver keyDeriver,
                               QueryProperties queryProperties) {
        this.queryShaper = queryShaper;
        this.templateRepository = templateRepository;
        this.warehouseClient = warehouseClient;
        this.tieredCache = tieredCache;
        this.keyDeriver = keyDeriver;
        this.columns = queryProperties.getColumns();
    }

    public RegionFilterOptions getFilterOptions() {
        List<String> regions = distinctValues(columns.getRegion());
        List<String> supplyChains = distinctValues(columns.getSupplyChain());
        log.debug("Region filter options: {} regions, {} supply chains", regions.size(), supplyChains.size());
        return new RegionFilterOptions(regions, supplyChains);
    }

    private List<String> distinctValues(String column) {
        LevelQuery query = queryShaper.shapeDistinct(templateRepository.hierarchy(), column);
        String key = keyDeriver.derive(query);
        List<Map<String, Object>> rows = tieredCache.getOrLoad(key, CascadeResolverService.ROWS,
            () -> warehouseClient.execute(query.sql(), query.parameters()), FILTER_OPTIONS_TTL).value();

        return rows.stream()
            .map(row -> row.get(column))
            .filter(Objects::nonNull)
            .map(value -> value.toString().trim())
            .filter(value -> !value.isEmpty())
            .distinct()
            .sorted()
            .toList();
    }
}
