package com.pmo.portfolio.exception;

/**
 * SQL 模板无法安全拼装（模板格式错误、多个 WHERE 等），属于开发期错误
 * 消息中只允许出现模板名、列名，不允许出现参数值
 */
public class QueryShapingException extends RuntimeException {

    public QueryShapingException(String message) {
        super(message);
    }
}
