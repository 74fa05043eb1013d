package com.pmo.portfolio.query;

import com.pmo.portfolio.config.QueryProperties;
import com.pmo.portfolio.exception.QueryShapingException;
import com.pmo.portfolio.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 查询拼装器
 * 把通用层级模板拼装成按层级过滤、参数化、带分页的语句
 *
 * <ul>
 *   <li>PORTFOLIO：结构性字面量 {@code COE_ROADMAP_TYPE = 'Portfolio'}，无绑定参数</li>
 *   <li>PROGRAM / SUB_PROGRAM：父节点列绑定 portfolio_id / program_id</li>
 *   <li>REGION：区域列绑定 region，可选 supply_chain</li>
 * </ul>
 */
@Component
public class QueryShaper {

    public static final String SUPPLY_CHAIN_KEY = "supply_chain";
    public static final String EXTERNAL_ID_PARAM_PREFIX = "external_id_";

    private final QueryProperties.Columns columns;
    private final int maxLimit;

    public QueryShaper(QueryProperties queryProperties) {
        this.columns = queryProperties.getColumns();
        this.maxLimit = queryProperties.getMaxLimit();
    }

    /**
     * 构建分页请求，limit 截断到配置上限
     */
    public PageRequest pageRequest(int page, int limit) {
        return PageRequest.of(page, limit, maxLimit);
    }

    /**
     * 层级查询拼装
     *
     * @throws ValidationException 层级必填参数缺失或为空
     */
    public LevelQuery shape(QueryTemplate template, HierarchyLevel level,
                            Map<String, String> context, PageRequest pageRequest) {
        SqlQueryBuilder builder = SqlQueryBuilder.from(template);

        switch (level) {
            case PORTFOLIO -> builder = builder.where(
                FilterClause.structural(columns.getRoadmapType(), columns.getPortfolioType()));
            case PROGRAM, SUB_PROGRAM -> builder = bindRequired(builder, columns.getParentId(), level, context);
            case REGION -> {
                builder = bindRequired(builder, columns.getRegion(), level, context);
                String supplyChain = context.get(SUPPLY_CHAIN_KEY);
                if (supplyChain != null && !supplyChain.isBlank()) {
                    builder = builder
                        .where(FilterClause.eq(columns.getSupplyChain(), SUPPLY_CHAIN_KEY))
                        .bind(SUPPLY_CHAIN_KEY, supplyChain.trim());
                }
            }
        }

        return builder
            .orderBy(List.of(columns.getChildId()))
            .page(pageRequest)
            .build();
    }

    /**
     * 投资查询拼装：每个外部 ID 单独绑定为 external_id_N，不做字符串拼接
     */
    public LevelQuery shapeInvestment(QueryTemplate template, Collection<String> externalIds) {
        if (externalIds.isEmpty()) {
            throw new QueryShapingException("Investment query needs at least one external id");
        }

        List<String> names = new ArrayList<>(externalIds.size());
        SqlQueryBuilder builder = SqlQueryBuilder.from(template);
        int i = 0;
        for (String id : externalIds) {
            String name = EXTERNAL_ID_PARAM_PREFIX + i++;
            names.add(name);
            builder = builder.bind(name, id);
        }

        return builder
            .where(FilterClause.in(columns.getInvestmentExternalId(), names))
            .orderBy(columns.getInvestmentOrder())
            .build();
    }

    /**
     * 不带过滤的全量投资查询（Portfolio 层使用）
     */
    public LevelQuery shapeUnfiltered(QueryTemplate template) {
        return SqlQueryBuilder.from(template)
            .orderBy(columns.getInvestmentOrder())
            .build();
    }

    /**
     * 某列去重取值，包裹原模板作为子查询
     */
    public LevelQuery shapeDistinct(QueryTemplate template, String column) {
        FilterClause.requireIdentifier(column);
        String inner = SqlQueryBuilder.stripTerminators(template.sql());
        String sql = "SELECT DISTINCT " + column + " FROM (\n" + inner + "\n) AS src\nORDER BY " + column;
        return new LevelQuery(sql, Map.of());
    }

    private SqlQueryBuilder bindRequired(SqlQueryBuilder builder, String column,
                                         HierarchyLevel level, Map<String, String> context) {
        String key = level.requiredContextKey();
        String value = context.get(key);
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required parameter: " + key);
        }
        return builder
            .where(FilterClause.eq(column, key))
            .bind(key, value.trim());
    }
}
