package com.pmo.portfolio.exception;

public class WarehouseConnectionException extends WarehouseException {

    public WarehouseConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
