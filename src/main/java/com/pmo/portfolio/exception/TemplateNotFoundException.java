package com.pmo.portfolio.exception;

public class TemplateNotFoundException extends RuntimeException {

    public TemplateNotFoundException(String templateName) {
        super("SQL template not found: " + templateName);
    }

    public TemplateNotFoundException(String templateName, Throwable cause) {
        super("SQL template not found: " + templateName, cause);
    }
}
