package com.pmo.portfolio.controller;

import com.pmo.portfolio.repository.WarehouseClient;
import com.pmo.portfolio.service.FastTierCacheService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 存活检查与连通性测试接口
 */
@WebMvcTest(SystemController.class)
class SystemControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WarehouseClient warehouseClient;

    @MockBean
    private FastTierCacheService fastTierCacheService;

    @Test
    @DisplayName("存活检查")
    void testHealth() throws Exception {
        when(fastTierCacheService.isAvailable()).thenReturn(false);

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("healthy"))
            .andExpect(jsonPath("$.data.fast_tier_available").value(false));
    }

    @Test
    @DisplayName("数仓连通")
    void testTestConnection_ok() throws Exception {
        when(warehouseClient.testConnection()).thenReturn(true);

        mockMvc.perform(get("/api/test-connection"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.connected").value(true));
    }

    @Test
    @DisplayName("数仓不通 - 500")
    void testTestConnection_failed() throws Exception {
        when(warehouseClient.testConnection()).thenReturn(false);

        mockMvc.perform(get("/api/test-connection"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value(500));
    }
}
