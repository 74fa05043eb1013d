package com.pmo.portfolio.dto;

import com.pmo.portfolio.query.PageRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 分页信息测试
 */
class PaginationInfoTest {

    @Test
    @DisplayName("满页 - has_more 为 true")
    void testEnvelope_fullPage() {
        PaginationInfo info = PaginationInfo.envelope(10, new PageRequest(3, 10));

        assertEquals(3, info.page());
        assertEquals(10, info.limit());
        assertEquals(10, info.totalItems());
        assertTrue(info.hasMore());
    }

    @Test
    @DisplayName("不满页或空页 - has_more 为 false")
    void testEnvelope_partialPage() {
        assertFalse(PaginationInfo.envelope(7, new PageRequest(1, 10)).hasMore());
        assertFalse(PaginationInfo.envelope(0, new PageRequest(2, 10)).hasMore());
    }
}
