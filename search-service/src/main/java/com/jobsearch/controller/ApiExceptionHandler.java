package com.jobsearch.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.jobsearch.dto.ApiError;
import com.jobsearch.query.QueryValidationException;
import com.jobsearch.service.SearchExecutionException;

import lombok.extern.slf4j.Slf4j;

/**
 * Перевод исключений в HTTP ответы.
 *
 * - ошибки клиента (кривое дерево, JSON, limit) -> 400 с причиной
 * - всё остальное -> 500 без подробностей, подробности только в логе
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final String INTERNAL_ERROR = "Internal server error";

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<ApiError> handleValidation(QueryValidationException e) {
        log.warn("Rejected search request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiError.of(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Rejected unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiError.of("Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Rejected request parameter '{}': {}", e.getName(), e.getValue());
        return ResponseEntity.badRequest().body(ApiError.of("Invalid value for parameter '" + e.getName() + "'"));
    }

    @ExceptionHandler(SearchExecutionException.class)
    public ResponseEntity<ApiError> handleSearchExecution(SearchExecutionException e) {
        // уже залогировано в JobSearchService
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.of(INTERNAL_ERROR));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiError> handleUnexpected(RuntimeException e) {
        log.error("Unhandled error while serving request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.of(INTERNAL_ERROR));
    }
}
