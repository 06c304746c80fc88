package com.keyguard.exception;

import com.keyguard.model.dto.ErrorResponse;
import com.keyguard.web.CorrelationIdFilter;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex,
                                                                      ServerWebExchange exchange) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDuplicateResource(DuplicateResourceException ex,
                                                                       ServerWebExchange exchange) {
        log.warn("Duplicate resource: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), null, exchange);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidRequest(InvalidRequestException ex,
                                                                    ServerWebExchange exchange) {
        log.warn("Validation error: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed", ex.getFieldErrors(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex,
                                                                         ServerWebExchange exchange) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> errors.putIfAbsent(error.getField(), error.getDefaultMessage()));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed", errors, exchange);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleConstraintViolation(ConstraintViolationException ex,
                                                                         ServerWebExchange exchange) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(violation -> errors.putIfAbsent(
                lastNode(violation.getPropertyPath().toString()), violation.getMessage()));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed", errors, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex,
                                                                    ServerWebExchange exchange) {
        log.warn("Malformed request: {}", ex.getReason());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed request", null, exchange);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleMethodValidation(HandlerMethodValidationException ex,
                                                                      ServerWebExchange exchange) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getAllValidationResults().forEach(result -> result.getResolvableErrors().stream()
                .findFirst()
                .ifPresent(error -> errors.putIfAbsent(
                        result.getMethodParameter().getParameterName(), error.getDefaultMessage())));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed", errors, exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex,
                                                                    ServerWebExchange exchange) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return respond(status, ex.getReason() != null ? ex.getReason() : status.getReasonPhrase(), null, exchange);
    }

    @ExceptionHandler({StoreUnavailableException.class, DataAccessException.class, TransactionException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleStoreUnavailable(RuntimeException ex,
                                                                      ServerWebExchange exchange) {
        log.error("Store unavailable", ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, StoreUnavailableException.MESSAGE, null, exchange);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null, exchange);
    }

    private static Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String detail,
                                                               Map<String, String> errors,
                                                               ServerWebExchange exchange) {
        ErrorResponse error = ErrorResponse.builder()
                .detail(detail)
                .correlationId(CorrelationIdFilter.correlationId(exchange))
                .errors(errors)
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }

    private static String lastNode(String propertyPath) {
        int dot = propertyPath.lastIndexOf('.');
        return dot < 0 ? propertyPath : propertyPath.substring(dot + 1);
    }
}
