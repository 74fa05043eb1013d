package com.pmo.portfolio.controller;

import com.pmo.portfolio.dto.ApiResponse;
import com.pmo.portfolio.dto.CacheStatsSnapshot;
import com.pmo.portfolio.dto.ClearCacheRequest;
import com.pmo.portfolio.service.TieredCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 缓存运维 API
 */
@Slf4j
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final TieredCacheService tieredCacheService;

    /**
     * 缓存统计
     */
    @GetMapping("/stats")
    public ApiResponse<CacheStatsSnapshot> getStats() {
        return ApiResponse.success(tieredCacheService.stats());
    }

    /**
     * 清理缓存，pattern 为空时全部清空
     */
    @PostMapping("/clear")
    public ResponseEntity<ApiResponse<Boolean>> clear(@RequestBody(required = false) ClearCacheRequest request) {
        String pattern = request == null ? null : request.getPattern();
        log.info("Manual cache clear, pattern: {}", pattern);

        if (tieredCacheService.clear(pattern)) {
            return ResponseEntity.ok(ApiResponse.success(true));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.serverError("Failed to clear cache"));
    }
}
