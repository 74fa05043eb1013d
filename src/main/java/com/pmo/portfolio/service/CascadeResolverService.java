package com.pmo.portfolio.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pmo.portfolio.config.CacheProperties;
import com.pmo.portfolio.config.QueryProperties;
import com.pmo.portfolio.dto.CacheInfo;
import com.pmo.portfolio.dto.LevelDataResponse;
import com.pmo.portfolio.dto.PaginationInfo;
import com.pmo.portfolio.query.HierarchyLevel;
import com.pmo.portfolio.query.LevelQuery;
import com.pmo.portfolio.query.PageRequest;
import com.pmo.portfolio.query.QueryShaper;
import com.pmo.portfolio.repository.QueryTemplateRepository;
import com.pmo.portfolio.repository.WarehouseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * 层级级联查询服务
 * <p>
 * 先查层级数据，取出子节点 ID，再用这些 ID 查投资数据；两次查询都走分层缓存。
 * Portfolio 层没有上游过滤条件，层级查询与全量投资查询并行执行
 */
@Service
public class CascadeResolverService {

    private static final Logger log = LoggerFactory.getLogger(CascadeResolverService.class);

    static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {};

    private final QueryShaper queryShaper;
    private final QueryTemplateRepository templateRepository;
    private final WarehouseClient warehouseClient;
    private final TieredCacheService tieredCache;
    private final CacheKeyDeriver keyDeriver;
    private final ExecutorService warehouseQueryExecutor;
    private final String childIdColumn;
    private final Duration ttl;

    public CascadeResolverService(QueryShaper queryShaper,
                                  QueryTemplateRepository templateRepository,
                                  WarehouseClient warehouseClient,
                                  TieredCacheService tieredCache,
                                  CacheKeyDeriver keyDeriver,
                                  @Qualifier("warehouseQueryExecutor") ExecutorService warehouseQueryExecutor,
                                  CacheProperties cacheProperties,
                                  QueryProperties queryProperties) {
        this.queryShaper = queryShaper;
        this.templateRepository = templateRepository;
        this.warehouseClient = warehouseClient;
        this.tieredCache = tieredCache;
        this.keyDeriver = keyDeriver;
        this.warehouseQueryExecutor = warehouseQueryExecutor;
        this.childIdColumn = queryProperties.getColumns().getChildId();
        this.ttl = Duration.ofSeconds(cacheProperties.getDefaultTtlSeconds());
    }

    /**
     * 查询某一层级的一页数据及其投资数据
     *
     * @param context 层级上下文，如 portfolio_id / program_id / region / supply_chain
     */
    public LevelDataResponse resolve(HierarchyLevel level, Map<String, String> context, int page, int limit) {
        PageRequest pageRequest = queryShaper.pageRequest(page, limit);
        LevelQuery hierarchyQuery = queryShaper.shape(templateRepository.hierarchy(), level, context, pageRequest);

        if (level == HierarchyLevel.PORTFOLIO) {
            return resolveInParallel(hierarchyQuery, pageRequest);
        }

        CacheLookup<List<Map<String, Object>>> hierarchy = fetch(hierarchyQuery);
        Set<String> childIds = extractChildIds(hierarchy.value());
        if (childIds.isEmpty()) {
            log.info("No child ids at level {}, investment query skipped", level);
            return new LevelDataResponse(hierarchy.value(), List.of(),
                PaginationInfo.envelope(hierarchy.value().size(), pageRequest),
                new CacheInfo(hierarchy.isHit(), true));
        }

        LevelQuery investmentQuery = queryShaper.shapeInvestment(templateRepository.investment(), childIds);
        CacheLookup<List<Map<String, Object>>> investment = fetch(investmentQuery);

        log.debug("Level {} resolved: {} hierarchy rows, {} child ids, {} investment rows",
            level, hierarchy.value().size(), childIds.size(), investment.value().size());
        return new LevelDataResponse(hierarchy.value(), investment.value(),
            PaginationInfo.envelope(hierarchy.value().size(), pageRequest),
            new CacheInfo(hierarchy.isHit(), investment.isHit()));
    }

    private LevelDataResponse resolveInParallel(LevelQuery hierarchyQuery, PageRequest pageRequest) {
        LevelQuery investmentQuery = queryShaper.shapeUnfiltered(templateRepository.investment());

        CompletableFuture<CacheLookup<List<Map<String, Object>>>> hierarchyFuture =
            CompletableFuture.supplyAsync(() -> fetch(hierarchyQuery), warehouseQueryExecutor);
        CompletableFuture<CacheLookup<List<Map<String, Object>>>> investmentFuture =
            CompletableFuture.supplyAsync(() -> fetch(investmentQuery), warehouseQueryExecutor);

        CacheLookup<List<Map<String, Object>>> hierarchy;
        try {
            hierarchy = join(hierarchyFuture);
        } catch (RuntimeException e) {
            // 层级查询失败时投资查询仍在执行，其结果不再有人等待，失败只记录日志
            investmentFuture.whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("Portfolio investment fetch failed after hierarchy failure: {}",
                        error instanceof CompletionException && error.getCause() != null
                            ? error.getCause().getMessage() : error.getMessage());
                }
            });
            throw e;
        }
        CacheLookup<List<Map<String, Object>>> investment = join(investmentFuture);

        return new LevelDataResponse(hierarchy.value(), investment.value(),
            PaginationInfo.envelope(hierarchy.value().size(), pageRequest),
            new CacheInfo(hierarchy.isHit(), investment.isHit()));
    }

    private CacheLookup<List<Map<String, Object>>> fetch(LevelQuery query) {
        String key = keyDeriver.derive(query);
        return tieredCache.getOrLoad(key, ROWS,
            () -> warehouseClient.execute(query.sql(), query.parameters()), ttl);
    }

    /**
     * 去重、去空，保持出现顺序
     */
    Set<String> extractChildIds(List<Map<String, Object>> rows) {
        Set<String> ids = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            Object value = row.get(childIdColumn);
            if (value != null) {
                String id = value.toString().trim();
                if (!id.isEmpty()) {
                    ids.add(id);
                }
            }
        }
        return ids;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
