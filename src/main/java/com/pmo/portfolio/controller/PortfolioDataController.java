package com.pmo.portfolio.controller;

import com.pmo.portfolio.config.QueryProperties;
import com.pmo.portfolio.dto.ApiResponse;
import com.pmo.portfolio.dto.LevelDataResponse;
import com.pmo.portfolio.dto.RegionFilterOptions;
import com.pmo.portfolio.query.HierarchyLevel;
import com.pmo.portfolio.query.QueryShaper;
import com.pmo.portfolio.service.CascadeResolverService;
import com.pmo.portfolio.service.RegionFilterService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 路线图层级数据控制器
 * 每个层级返回一页层级数据及其关联的投资数据
 */
@RestController
@RequestMapping("/api/data")
public class PortfolioDataController {

    private static final Logger log = LoggerFactory.getLogger(PortfolioDataController.class);

    private final CascadeResolverService resolverService;
    private final RegionFilterService regionFilterService;
    private final int defaultLimit;

    public PortfolioDataController(CascadeResolverService resolverService,
                                   RegionFilterService regionFilterService,
                                   QueryProperties queryProperties) {
        this.resolverService = resolverService;
        this.regionFilterService = regionFilterService;
        this.defaultLimit = queryProperties.getDefaultLimit();
    }

    /**
     * GET /api/data/portfolio
     */
    @GetMapping("/portfolio")
    public ResponseEntity<ApiResponse<LevelDataResponse>> getPortfolioData(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer limit) {
        return resolve(HierarchyLevel.PORTFOLIO, Map.of(), page, limit);
    }

    /**
     * GET /api/data/program?portfolioId=
     */
    @GetMapping("/program")
    public ResponseEntity<ApiResponse<LevelDataResponse>> getProgramData(
            @RequestParam(required = false) String portfolioId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer limit) {
        Map<String, String> context = new HashMap<>();
        context.put(HierarchyLevel.PROGRAM.requiredContextKey(), portfolioId);
        return resolve(HierarchyLevel.PROGRAM, context, page, limit);
    }

    /**
     * GET /api/data/subprogram?programId=
     */
    @GetMapping("/subprogram")
    public ResponseEntity<ApiResponse<LevelDataResponse>> getSubProgramData(
            @RequestParam(required = false) String programId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer limit) {
        Map<String, String> context = new HashMap<>();
        context.put(HierarchyLevel.SUB_PROGRAM.requiredContextKey(), programId);
        return resolve(HierarchyLevel.SUB_PROGRAM, context, page, limit);
    }

    /**
     * GET /api/data/region?region=&supply_chain=
     */
    @GetMapping("/region")
    public ResponseEntity<ApiResponse<LevelDataResponse>> getRegionData(
            @RequestParam(required = false) String region,
            @RequestParam(name = "supply_chain", required = false) String supplyChain,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer limit) {
        Map<String, String> context = new HashMap<>();
        context.put(HierarchyLevel.REGION.requiredContextKey(), region);
        context.put(QueryShaper.SUPPLY_CHAIN_KEY, supplyChain);
        return resolve(HierarchyLevel.REGION, context, page, limit);
    }

    /**
     * GET /api/data/region/filters
     */
    @GetMapping("/region/filters")
    public ResponseEntity<ApiResponse<RegionFilterOptions>> getRegionFilters() {
        return ResponseEntity.ok(ApiResponse.success(regionFilterService.getFilterOptions()));
    }

    private ResponseEntity<ApiResponse<LevelDataResponse>> resolve(HierarchyLevel level, Map<String, String> context,
                                                                   int page, Integer limit) {
        long startTime = System.currentTimeMillis();

        LevelDataResponse data = resolverService.resolve(level, context, page,
            limit == null ? defaultLimit : limit);

        long duration = System.currentTimeMillis() - startTime;
        log.info("{} data served: page={}, hierarchy={}, investment={}, cached={}, duration={}ms",
            level, page, data.hierarchy().size(), data.investment().size(),
            data.cacheInfo().cached(), duration);

        return ResponseEntity.ok(ApiResponse.success(data));
    }
}
