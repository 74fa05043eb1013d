package com.pmo.portfolio.query;

import com.pmo.portfolio.config.QueryProperties;
import com.pmo.portfolio.exception.QueryShapingException;
import com.pmo.portfolio.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 查询拼装测试
 */
class QueryShaperTest {

    private static final QueryTemplate HIERARCHY = new QueryTemplate("hierarchy_query", "SELECT * FROM t");

    private final QueryShaper shaper = new QueryShaper(new QueryProperties());

    @Test
    @DisplayName("Program 层 - 参数绑定，值不进入 SQL")
    void testShape_programBindsParameter() {
        LevelQuery query = shaper.shape(HIERARCHY, HierarchyLevel.PROGRAM,
            Map.of("portfolio_id", "PTF1"), shaper.pageRequest(1, 50));

        assertEquals(1, countWhere(query.sql()));
        assertTrue(query.sql().contains("COE_ROADMAP_PARENT_ID = :portfolio_id"));
        assertFalse(query.sql().contains("PTF1"));
        assertEquals(Map.of("portfolio_id", "PTF1"), query.parameters());
    }

    @Test
    @DisplayName("Portfolio 层 - 结构性字面量，第 2 页每页 10 条")
    void testShape_portfolioSecondPage() {
        LevelQuery query = shaper.shape(HIERARCHY, HierarchyLevel.PORTFOLIO, Map.of(), shaper.pageRequest(2, 10));

        assertEquals("SELECT * FROM t\nWHERE COE_ROADMAP_TYPE = 'Portfolio'\nORDER BY CHILD_ID LIMIT 10 OFFSET 10",
            query.sql());
        assertTrue(query.parameters().isEmpty());
    }

    @Test
    @DisplayName("Program 层 - 插入 WHERE，第 2 页每页 10 条")
    void testShape_programSecondPage() {
        LevelQuery query = shaper.shape(HIERARCHY, HierarchyLevel.PROGRAM,
            Map.of("portfolio_id", "PTF1"), shaper.pageRequest(2, 10));

        assertEquals("SELECT * FROM t\nWHERE COE_ROADMAP_PARENT_ID = :portfolio_id\nORDER BY CHILD_ID LIMIT 10 OFFSET 10",
            query.sql());
        assertTrue(query.sql().endsWith("LIMIT 10 OFFSET 10"));
        assertEquals(Map.of("portfolio_id", "PTF1"), query.parameters());
    }

    @Test
    @DisplayName("模板条件含 OR - 整体加括号后再追加层级过滤")
    void testShape_templateOrPredicateStaysScoped() {
        QueryTemplate template = new QueryTemplate("either", "SELECT * FROM t WHERE a = 1 OR b = 2 -- legacy");

        LevelQuery query = shaper.shape(template, HierarchyLevel.PROGRAM,
            Map.of("portfolio_id", "PTF1"), shaper.pageRequest(1, 10));

        assertEquals("SELECT * FROM t WHERE (a = 1 OR b = 2 -- legacy\n)"
                + "\n  AND COE_ROADMAP_PARENT_ID = :portfolio_id\nORDER BY CHILD_ID LIMIT 10 OFFSET 0",
            query.sql());
    }

    @Test
    @DisplayName("模板已有 WHERE - 用 AND 追加，去掉末尾分号")
    void testShape_appendsWithAnd() {
        QueryTemplate template = new QueryTemplate("filtered", "SELECT * FROM t where active = 1;\n");

        LevelQuery query = shaper.shape(template, HierarchyLevel.SUB_PROGRAM,
            Map.of("program_id", "PRG7"), shaper.pageRequest(1, 20));

        assertEquals(1, countWhere(query.sql()));
        assertTrue(query.sql().contains("where (active = 1\n)\n  AND COE_ROADMAP_PARENT_ID = :program_id"));
        assertFalse(query.sql().contains(";"));
        assertTrue(query.sql().endsWith("LIMIT 20 OFFSET 0"));
    }

    @Test
    @DisplayName("Region 层 - 可选 supply_chain")
    void testShape_regionWithSupplyChain() {
        LevelQuery query = shaper.shape(HIERARCHY, HierarchyLevel.REGION,
            Map.of("region", " EMEA ", "supply_chain", "Retail"), shaper.pageRequest(1, 50));

        assertTrue(query.sql().contains("WHERE REGION = :region\n  AND SUPPLY_CHAIN = :supply_chain"));
        assertEquals(Map.of("region", "EMEA", "supply_chain", "Retail"), query.parameters());

        LevelQuery regionOnly = shaper.shape(HIERARCHY, HierarchyLevel.REGION,
            Map.of("region", "EMEA", "supply_chain", " "), shaper.pageRequest(1, 50));
        assertFalse(regionOnly.sql().contains("SUPPLY_CHAIN"));
    }

    @Test
    @DisplayName("注入尝试 - 值只作为绑定参数")
    void testShape_injectionAttemptStaysBound() {
        String hostile = "x' OR '1'='1";

        LevelQuery query = shaper.shape(HIERARCHY, HierarchyLevel.PROGRAM,
            Map.of("portfolio_id", hostile), shaper.pageRequest(1, 50));

        assertFalse(query.sql().contains("OR '1'"));
        assertEquals(hostile, query.parameters().get("portfolio_id"));
    }

    @Test
    @DisplayName("缺少或空白的必填参数 - ValidationException")
    void testShape_missingContext() {
        PageRequest page = shaper.pageRequest(1, 50);

        ValidationException missing = assertThrows(ValidationException.class,
            () -> shaper.shape(HIERARCHY, HierarchyLevel.PROGRAM, Map.of(), page));
        assertTrue(missing.getMessage().contains("portfolio_id"));

        assertThrows(ValidationException.class,
            () -> shaper.shape(HIERARCHY, HierarchyLevel.REGION, Map.of("region", "  "), page));
    }

    @Test
    @DisplayName("limit 截断到 50，非法分页参数被拒绝")
    void testPageRequest() {
        assertEquals(50, shaper.pageRequest(1, 500).limit());
        assertEquals(90, shaper.pageRequest(4, 30).offset());
        assertThrows(ValidationException.class, () -> shaper.pageRequest(0, 10));
        assertThrows(ValidationException.class, () -> shaper.pageRequest(1, 0));
    }

    @Test
    @DisplayName("模板含多个 WHERE 或自带 ORDER BY - QueryShapingException")
    void testShape_malformedTemplate() {
        PageRequest page = shaper.pageRequest(1, 50);
        QueryTemplate twoWheres = new QueryTemplate("bad",
            "SELECT * FROM (SELECT * FROM a WHERE x = 1) s WHERE y = 2");
        QueryTemplate ordered = new QueryTemplate("ordered", "SELECT * FROM t ORDER BY id");

        assertThrows(QueryShapingException.class,
            () -> shaper.shape(twoWheres, HierarchyLevel.PORTFOLIO, Map.of(), page));
        assertThrows(QueryShapingException.class,
            () -> shaper.shape(ordered, HierarchyLevel.PORTFOLIO, Map.of(), page));
        assertThrows(QueryShapingException.class,
            () -> shaper.shape(new QueryTemplate("empty", " ; "), HierarchyLevel.PORTFOLIO, Map.of(), page));
        assertThrows(QueryShapingException.class,
            () -> shaper.shape(new QueryTemplate("grouped", "SELECT a FROM t WHERE b = 1 GROUP BY a"),
                HierarchyLevel.PORTFOLIO, Map.of(), page));
    }

    @Test
    @DisplayName("投资查询 - 每个 ID 单独绑定")
    void testShapeInvestment() {
        QueryTemplate template = new QueryTemplate("investment_query", "SELECT * FROM inv");

        LevelQuery query = shaper.shapeInvestment(template, List.of("INV1", "INV2", "INV3"));

        assertEquals("SELECT * FROM inv\nWHERE INV_EXT_ID IN (:external_id_0, :external_id_1, :external_id_2)"
            + "\nORDER BY INV_EXT_ID, ROADMAP_ELEMENT, TASK_START", query.sql());
        assertEquals(Map.of("external_id_0", "INV1", "external_id_1", "INV2", "external_id_2", "INV3"),
            query.parameters());
        assertThrows(QueryShapingException.class, () -> shaper.shapeInvestment(template, List.of()));
    }

    @Test
    @DisplayName("全量投资查询与去重查询")
    void testShapeUnfilteredAndDistinct() {
        QueryTemplate template = new QueryTemplate("investment_query", "SELECT * FROM inv;");

        assertEquals("SELECT * FROM inv\nORDER BY INV_EXT_ID, ROADMAP_ELEMENT, TASK_START",
            shaper.shapeUnfiltered(template).sql());
        assertEquals("SELECT DISTINCT REGION FROM (\nSELECT * FROM t\n) AS src\nORDER BY REGION",
            shaper.shapeDistinct(HIERARCHY, "REGION").sql());
        assertThrows(QueryShapingException.class, () -> shaper.shapeDistinct(HIERARCHY, "REGION; DROP"));
    }

    private static int countWhere(String sql) {
        Matcher matcher = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE).matcher(sql);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
