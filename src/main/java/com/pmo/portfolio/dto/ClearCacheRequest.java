package com.pmo.portfolio.dto;

import lombok.Data;

/**
 * 缓存清理请求，pattern 为空时清空全部
 */
@Data
public class ClearCacheRequest {

    private String pattern;
}
