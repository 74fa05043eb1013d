package com.pmo.portfolio.query;

import com.pmo.portfolio.exception.QueryShapingException;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 过滤条件：(列, 操作符, 绑定参数名)
 * <p>
 * 只有列名、参数名会进入 SQL 文本，二者都必须是合法标识符；参数值一律走绑定。
 * STRUCTURAL_EQ 仅用于代码中写死的结构性字面量（如 'Portfolio'），不接受用户输入。
 */
public record FilterClause(String column, Operator operator, List<String> parameterNames, String literal) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");
    private static final Pattern STRUCTURAL_LITERAL = Pattern.compile("[A-Za-z0-9 _-]+");

    public enum Operator {
        EQ,
        IN,
        STRUCTURAL_EQ
    }

    public FilterClause {
        requireIdentifier(column);
        parameterNames = List.copyOf(parameterNames);
        parameterNames.forEach(FilterClause::requireIdentifier);
        switch (operator) {
            case EQ -> {
                if (parameterNames.size() != 1) {
                    throw new QueryShapingException("EQ filter on " + column + " needs exactly one parameter");
                }
            }
            case IN -> {
                if (parameterNames.isEmpty()) {
                    throw new QueryShapingException("IN filter on " + column + " needs at least one parameter");
                }
            }
            case STRUCTURAL_EQ -> {
                if (literal == null || !STRUCTURAL_LITERAL.matcher(literal).matches()) {
                    throw new QueryShapingException("Unsafe structural literal for column " + column);
                }
            }
        }
    }

    public static FilterClause eq(String column, String parameterName) {
        return new FilterClause(column, Operator.EQ, List.of(parameterName), null);
    }

    public static FilterClause in(String column, List<String> parameterNames) {
        return new FilterClause(column, Operator.IN, parameterNames, null);
    }

    public static FilterClause structural(String column, String literal) {
        return new FilterClause(column, Operator.STRUCTURAL_EQ, List.of(), literal);
    }

    public String toSql() {
        return switch (operator) {
            case EQ -> column + " = :" + parameterNames.get(0);
            case IN -> column + " IN (" + parameterNames.stream()
                .map(name -> ":" + name)
                .collect(Collectors.joining(", ")) + ")";
            case STRUCTURAL_EQ -> column + " = '" + literal + "'";
        };
    }

    static String requireIdentifier(String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new QueryShapingException("Invalid SQL identifier");
        }
        return value;
    }
}
