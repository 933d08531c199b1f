package com.firefly.kbagent.exception;

import com.firefly.kbagent.vo.ApiResponse;
import com.firefly.kbagent.web.CorrelationIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 错误响应契约：校验失败400，授权失败403，其余一律500。
 * 500响应只返回固定文本和关联ID，详细信息只写入日志。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String INTERNAL_ERROR_MESSAGE = "An unexpected error occurred while processing your request";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationException(ValidationException ex) {
        log.warn("请求参数无效: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage(), 400, requestId());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("请求体无法解析: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error("Invalid JSON in request body", 400, requestId());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ApiResponse<Object>> handleAuthorizationException(AuthorizationException ex) {
        log.warn("访问被拒绝: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage(), 403, requestId());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(response);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiResponse<Object>> handleAccessDeniedException(AccessDeniedException ex) {
        log.warn("权限不足: {}", ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error("Access denied", 403, requestId());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        String requestId = requestId();
        log.error("服务器内部错误: requestId={}, type={}", requestId, ex.getClass().getSimpleName(), ex);
        ApiResponse<Object> response = ApiResponse.error(INTERNAL_ERROR_MESSAGE, 500, requestId);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private static String requestId() {
        return MDC.get(CorrelationIdFilter.MDC_KEY);
    }
}
