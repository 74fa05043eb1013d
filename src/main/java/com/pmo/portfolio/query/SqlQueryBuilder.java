package com.pmo.portfolio.query;

import com.pmo.portfolio.exception.QueryShapingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 不可变 SQL 构建器
 * 每次 where/bind/orderBy/page 都返回新实例；build 时校验所有过滤条件引用的参数均已绑定
 */
public final class SqlQueryBuilder {

    private static final Pattern WHERE = Pattern.compile("\\bWHERE\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_CLAUSES =
        Pattern.compile("\\b(ORDER\\s+BY|LIMIT|OFFSET)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern GROUPING_CLAUSES =
        Pattern.compile("\\b(GROUP\\s+BY|HAVING)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_TERMINATORS = Pattern.compile("[\\s;]+$");

    private final String templateName;
    private final String baseSql;
    private final boolean templateHasWhere;
    private final List<FilterClause> filters;
    private final Map<String, Object> parameters;
    private final List<String> orderBy;
    private final PageRequest page;

    private SqlQueryBuilder(String templateName, String baseSql, boolean templateHasWhere,
                            List<FilterClause> filters, Map<String, Object> parameters,
                            List<String> orderBy, PageRequest page) {
        this.templateName = templateName;
        this.baseSql = baseSql;
        this.templateHasWhere = templateHasWhere;
        this.filters = filters;
        this.parameters = parameters;
        this.orderBy = orderBy;
        this.page = page;
    }

    /**
     * 以模板为基础创建构建器
     * 模板末尾的分号会被去掉；模板不能自带 ORDER BY / LIMIT / OFFSET，也不能有多个 WHERE
     * 模板已有的 WHERE 条件会被加上括号
     */
    public static SqlQueryBuilder from(QueryTemplate template) {
        String sql = stripTerminators(template.sql());
        if (sql.isEmpty()) {
            throw new QueryShapingException("Template is empty: " + template.name());
        }

        int whereCount = count(WHERE, sql);
        if (whereCount > 1) {
            throw new QueryShapingException("Template has more than one WHERE clause: " + template.name());
        }
        if (TRAILING_CLAUSES.matcher(sql).find()) {
            throw new QueryShapingException("Template must not contain ORDER BY/LIMIT/OFFSET: " + template.name());
        }

        if (whereCount == 1) {
            sql = parenthesizePredicate(sql, template.name());
        }

        return new SqlQueryBuilder(template.name(), sql, whereCount == 1,
            List.of(), Map.of(), List.of(), null);
    }

    /**
     * 模板自带的 WHERE 条件整体加括号，追加的 AND 才能约束所有行（条件中含 OR 时也一样）
     * 括号另起一行收尾，避免被条件末尾的行注释吞掉
     */
    static String parenthesizePredicate(String sql, String templateName) {
        Matcher matcher = WHERE.matcher(sql);
        if (!matcher.find()) {
            return sql;
        }
        String predicate = sql.substring(matcher.end()).strip();
        if (predicate.isEmpty()) {
            throw new QueryShapingException("Template has an empty WHERE clause: " + templateName);
        }
        if (GROUPING_CLAUSES.matcher(predicate).find()) {
            throw new QueryShapingException("Template must not contain GROUP BY/HAVING after WHERE: " + templateName);
        }
        return sql.substring(0, matcher.end()) + " (" + predicate + "\n)";
    }

    /**
     * 去掉末尾的空白与语句结束符
     */
    public static String stripTerminators(String sql) {
        return TRAILING_TERMINATORS.matcher(sql.strip()).replaceAll("");
    }

    public SqlQueryBuilder where(FilterClause clause) {
        List<FilterClause> next = new ArrayList<>(filters);
        next.add(clause);
        return new SqlQueryBuilder(templateName, baseSql, templateHasWhere,
            Collections.unmodifiableList(next), parameters, orderBy, page);
    }

    public SqlQueryBuilder bind(String name, Object value) {
        FilterClause.requireIdentifier(name);
        if (value == null) {
            throw new QueryShapingException("Null value bound to parameter " + name);
        }
        Map<String, Object> next = new LinkedHashMap<>(parameters);
        next.put(name, value);
        return new SqlQueryBuilder(templateName, baseSql, templateHasWhere,
            filters, Collections.unmodifiableMap(next), orderBy, page);
    }

    public SqlQueryBuilder orderBy(List<String> columns) {
        columns.forEach(FilterClause::requireIdentifier);
        return new SqlQueryBuilder(templateName, baseSql, templateHasWhere,
            filters, parameters, List.copyOf(columns), page);
    }

    public SqlQueryBuilder page(PageRequest pageRequest) {
        return new SqlQueryBuilder(templateName, baseSql, templateHasWhere,
            filters, parameters, orderBy, pageRequest);
    }

    public LevelQuery build() {
        for (FilterClause clause : filters) {
            for (String name : clause.parameterNames()) {
                if (!parameters.containsKey(name)) {
                    throw new QueryShapingException("Unbound parameter " + name + " in template " + templateName);
                }
            }
        }

        // 每个追加子句另起一行，避免模板末尾的行注释吞掉条件
        StringBuilder sql = new StringBuilder(baseSql);
        boolean hasWhere = templateHasWhere;
        for (FilterClause clause : filters) {
            sql.append(hasWhere ? "\n  AND " : "\nWHERE ").append(clause.toSql());
            hasWhere = true;
        }

        if (!orderBy.isEmpty()) {
            sql.append("\nORDER BY ").append(String.join(", ", orderBy));
        }

        if (page != null) {
            if (orderBy.isEmpty()) {
                throw new QueryShapingException("Pagination without ORDER BY in template " + templateName);
            }
            // 仅内联经过整型校验的 limit/offset
            sql.append(" LIMIT ").append(page.limit()).append(" OFFSET ").append(page.offset());
        }

        return new LevelQuery(sql.toString(), parameters);
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
