package com.pmo.portfolio.exception;

public class WarehouseTimeoutException extends WarehouseException {

    public WarehouseTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
