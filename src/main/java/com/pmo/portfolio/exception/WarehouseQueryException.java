package com.pmo.portfolio.exception;

public class WarehouseQueryException extends WarehouseException {

    public WarehouseQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
