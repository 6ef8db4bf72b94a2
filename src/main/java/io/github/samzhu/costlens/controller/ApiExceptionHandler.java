package io.github.samzhu.costlens.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.costlens.dto.api.ErrorResponse;
import io.github.samzhu.costlens.exception.CostValidationException;

/**
 * API 例外處理。
 *
 * <p>輸入資料錯誤一律轉為 400；分析流程本身不攔截驗證異常。
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CostValidationException.class)
    public ResponseEntity<ErrorResponse> handleCostValidation(CostValidationException ex) {
        log.warn("Rejected cost data: {}", ex.getMessage());
        return build("VALIDATION_ERROR", ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String field = fieldError != null ? fieldError.getField() : null;
        String message = fieldError != null ? fieldError.getDefaultMessage() : "invalid request";
        log.warn("Rejected request: field={}, message={}", field, message);
        return build("VALIDATION_ERROR", message, field);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return build("MALFORMED_REQUEST", "request body could not be parsed", null);
    }

    private ResponseEntity<ErrorResponse> build(String code, String message, String field) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(code, message, field));
    }
}
