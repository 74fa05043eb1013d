package com.pmo.portfolio.controller;

import com.pmo.portfolio.dto.ApiResponse;
import com.pmo.portfolio.repository.WarehouseClient;
import com.pmo.portfolio.service.FastTierCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 存活检查与数仓连通性测试
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SystemController {

    private final WarehouseClient warehouseClient;
    private final FastTierCacheService fastTierCacheService;

    @GetMapping("/health")
    public ApiResponse<Map<String, Object>> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "healthy");
        status.put("fast_tier_available", fastTierCacheService.isAvailable());
        return ApiResponse.success(status);
    }

    @GetMapping("/test-connection")
    public ResponseEntity<ApiResponse<Map<String, Object>>> testConnection() {
        boolean connected = warehouseClient.testConnection();
        log.info("Warehouse connection test: {}", connected ? "OK" : "FAILED");
        if (connected) {
            return ResponseEntity.ok(ApiResponse.success(Map.of("connected", true)));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.serverError("Warehouse connection failed"));
    }
}
