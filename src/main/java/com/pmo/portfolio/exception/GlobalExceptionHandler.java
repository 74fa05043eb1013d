package com.pmo.portfolio.exception;

import com.pmo.portfolio.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 参数校验失败
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.badRequest(ex.getMessage()));
    }

    /**
     * 参数类型不匹配（如 page=abc）
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid request parameter: {}", ex.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.badRequest("Invalid parameter: " + ex.getName()));
    }

    /**
     * 数仓超时
     */
    @ExceptionHandler(WarehouseTimeoutException.class)
    public ResponseEntity<ApiResponse<Void>> handleWarehouseTimeout(WarehouseTimeoutException ex) {
        log.error("Warehouse timeout: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
            .body(ApiResponse.error(504, "数仓查询超时，请稍后重试"));
    }

    /**
     * 数仓连接/查询异常
     */
    @ExceptionHandler(WarehouseException.class)
    public ResponseEntity<ApiResponse<Void>> handleWarehouse(WarehouseException ex) {
        log.error("Warehouse error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.serverError("数仓服务异常，请稍后重试"));
    }

    /**
     * 模板或 SQL 拼装错误，细节只进日志
     */
    @ExceptionHandler({QueryShapingException.class, TemplateNotFoundException.class})
    public ResponseEntity<ApiResponse<Void>> handleQueryShaping(RuntimeException ex) {
        log.error("Query shaping error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.serverError("查询构建失败"));
    }

    /**
     * 处理所有未捕获异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.serverError("系统异常，请稍后重试"));
    }
}
