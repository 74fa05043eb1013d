package com.pmo.portfolio.repository;

import com.pmo.portfolio.config.QueryProperties;
import com.pmo.portfolio.exception.TemplateNotFoundException;
import com.pmo.portfolio.query.QueryTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SQL 模板仓库测试
 */
class QueryTemplateRepositoryTest {

    private final QueryTemplateRepository repository =
        new QueryTemplateRepository(new DefaultResourceLoader(), new QueryProperties());

    @Test
    @DisplayName("加载类路径下的模板并缓存")
    void testLoad() {
        QueryTemplate hierarchy = repository.hierarchy();

        assertEquals("hierarchy_query", hierarchy.name());
        assertTrue(hierarchy.sql().contains("COE_ROADMAP_PARENT_ID"));
        assertSame(hierarchy, repository.load("hierarchy_query"));
    }

    @Test
    @DisplayName("模板不存在 - TemplateNotFoundException")
    void testLoad_missing() {
        TemplateNotFoundException ex = assertThrows(TemplateNotFoundException.class,
            () -> repository.load("no_such_template"));
        assertTrue(ex.getMessage().contains("no_such_template"));
    }
}
