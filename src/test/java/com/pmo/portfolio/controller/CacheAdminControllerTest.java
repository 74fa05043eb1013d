package com.pmo.portfolio.controller;

import com.pmo.portfolio.dto.CacheStatsSnapshot;
import com.pmo.portfolio.service.TieredCacheService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 缓存运维控制器测试
 */
@WebMvcTest(CacheAdminController.class)
class CacheAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TieredCacheService tieredCacheService;

    @Test
    @DisplayName("缓存统计")
    void testGetStats() throws Exception {
        when(tieredCacheService.stats())
            .thenReturn(new CacheStatsSnapshot(false, 12, null, null, 3, 4, 5));

        mockMvc.perform(get("/api/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data.fast_tier_available").value(false))
            .andExpect(jsonPath("$.data.durable_entry_count").value(12))
            .andExpect(jsonPath("$.data.misses").value(5.0));
    }

    @Test
    @DisplayName("按 pattern 清理")
    void testClear_withPattern() throws Exception {
        when(tieredCacheService.clear("pmo_query_ab")).thenReturn(true);

        mockMvc.perform(post("/api/cache/clear")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"pattern\":\"pmo_query_ab\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value(true));
    }

    @Test
    @DisplayName("无请求体 - 全部清空")
    void testClear_noBody() throws Exception {
        when(tieredCacheService.clear(null)).thenReturn(true);

        mockMvc.perform(post("/api/cache/clear"))
            .andExpect(status().isOk());

        verify(tieredCacheService).clear(isNull());
    }

    @Test
    @DisplayName("清理失败 - 500")
    void testClear_failure() throws Exception {
        when(tieredCacheService.clear(null)).thenReturn(false);

        mockMvc.perform(post("/api/cache/clear")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value(500));
    }
}
