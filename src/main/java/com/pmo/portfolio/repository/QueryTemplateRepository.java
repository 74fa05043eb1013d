package com.pmo.portfolio.repository;

import com.pmo.portfolio.config.QueryProperties;
import com.pmo.portfolio.exception.TemplateNotFoundException;
import com.pmo.portfolio.query.QueryTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SQL 模板仓库，启动时加载一次
 */
@Slf4j
@Repository
public class QueryTemplateRepository {

    private final ResourceLoader resourceLoader;
    private final QueryProperties queryProperties;
    private final Map<String, QueryTemplate> templates = new ConcurrentHashMap<>();

    public QueryTemplateRepository(ResourceLoader resourceLoader, QueryProperties queryProperties) {
        this.resourceLoader = resourceLoader;
        this.queryProperties = queryProperties;
    }

    /**
     * 启动时预加载，模板缺失直接启动失败
     */
    @PostConstruct
    public void preload() {
        hierarchy();
        investment();
        log.info("SQL templates loaded: {}", templates.keySet());
    }

    public QueryTemplate load(String name) {
        return templates.computeIfAbsent(name, this::read);
    }

    public QueryTemplate hierarchy() {
        return load(queryProperties.getHierarchyTemplate());
    }

    public QueryTemplate investment() {
        return load(queryProperties.getInvestmentTemplate());
    }

    private QueryTemplate read(String name) {
        Resource resource = resourceLoader.getResource(queryProperties.getTemplateLocation() + name + ".sql");
        if (!resource.exists()) {
            throw new TemplateNotFoundException(name);
        }
        try {
            return new QueryTemplate(name, resource.getContentAsString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TemplateNotFoundException(name, e);
        }
    }
}
