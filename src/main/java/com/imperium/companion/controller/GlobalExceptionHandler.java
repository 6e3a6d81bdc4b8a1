package com.imperium.companion.controller;

import com.imperium.companion.config.RequestIdSupport;
import com.imperium.companion.exception.ConversationBusyException;
import com.imperium.companion.exception.DomainValidationException;
import com.imperium.companion.exception.MissingIdentityException;
import com.imperium.companion.exception.OwnershipViolationException;
import com.imperium.companion.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理：统一返回 {"error": {code, message, requestId, details}} 结构。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Validation failed");
        String field = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField())
                .orElse(null);
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", message, field);
    }

    @ExceptionHandler(DomainValidationException.class)
    public ResponseEntity<Map<String, Object>> handleDomainValidation(DomainValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", "Malformed request body", null);
    }

    @ExceptionHandler(MissingIdentityException.class)
    public ResponseEntity<Map<String, Object>> handleMissingIdentity(MissingIdentityException ex) {
        return error(HttpStatus.UNAUTHORIZED, "unauthorized", ex.getMessage(), null);
    }

    @ExceptionHandler(OwnershipViolationException.class)
    public ResponseEntity<Map<String, Object>> handleOwnership(OwnershipViolationException ex) {
        log.warn("Cross-user access rejected: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, "forbidden", ex.getMessage(), null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), null);
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateKeyException ex) {
        return error(HttpStatus.CONFLICT, "conflict", "Resource already exists", null);
    }

    @ExceptionHandler(ConversationBusyException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(ConversationBusyException ex) {
        return error(HttpStatus.CONFLICT, "conversation_busy", ex.getMessage(), null);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message,
            String field) {
        Map<String, Object> err = new HashMap<>();
        err.put("code", code);
        err.put("message", message != null ? message : status.getReasonPhrase());
        err.put("requestId", resolveRequestId());
        if (field != null) {
            err.put("details", Map.of("field", field));
        }
        return ResponseEntity.status(status).body(Map.of("error", err));
    }

    private static String resolveRequestId() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return RequestIdSupport.newRequestId();
        }
        HttpServletRequest request = attributes.getRequest();
        return RequestIdSupport.resolve(request);
    }
}
