package com.pmo.portfolio.exception;

/**
 * 请求参数缺失或非法，按客户端错误返回，不重试
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
