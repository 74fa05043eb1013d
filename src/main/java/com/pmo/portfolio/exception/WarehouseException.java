package com.pmo.portfolio.exception;

/**
 * 数仓访问异常基类
 * 服务内部不做重试，重试由调用方决定
 */
public class WarehouseException extends RuntimeException {

    public WarehouseException(String message, Throwable cause) {
        super(message, cause);
    }
}
