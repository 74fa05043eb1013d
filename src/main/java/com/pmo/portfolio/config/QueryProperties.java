package com.pmo.portfolio.config;

import com.pmo.portfolio.constant.CacheConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 层级查询配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "pmo.query")
public class QueryProperties {

    /** 单页最大条数 */
    private int maxLimit = CacheConstants.MAX_PAGE_LIMIT;

    /** 默认每页条数 */
    private int defaultLimit = CacheConstants.MAX_PAGE_LIMIT;

    /** 模板所在目录 */
    private String templateLocation = "classpath:sql/";

    private String hierarchyTemplate = "hierarchy_query";

    private String investmentTemplate = "investment_query";

    /** 数仓查询超时（秒） */
    private int warehouseTimeoutSeconds = 60;

    /** Portfolio 层并行查询线程数 */
    private int parallelFetchThreads = 8;

    private Columns columns = new Columns();

    /**
     * 列名映射，均作为标识符校验后写入 SQL
     */
    @Data
    public static class Columns {
        private String roadmapType = "COE_ROADMAP_TYPE";
        private String portfolioType = "Portfolio";
        private String parentId = "COE_ROADMAP_PARENT_ID";
        private String childId = "CHILD_ID";
        private String region = "REGION";
        private String supplyChain = "SUPPLY_CHAIN";
        private String investmentExternalId = "INV_EXT_ID";
        private List<String> investmentOrder = new ArrayList<>(List.of("INV_EXT_ID", "ROADMAP_ELEMENT", "TASK_START"));
    }
}
