package com.flagship.game_economy.api;

import com.flagship.game_economy.common.exception.EconomyException;
import com.flagship.game_economy.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders every failure in the {@link ApiResponse} envelope.
 *
 * Domain errors keep their {@link ErrorCode}; infrastructure failures collapse to
 * TRANSIENT_FAILURE or INTERNAL_ERROR so internals never leak to clients.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    static final String TRANSIENT_FAILURE = "TRANSIENT_FAILURE";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(EconomyException.class)
    public ResponseEntity<ApiResponse<Void>> handleEconomyException(EconomyException e) {
        log.warn("Economy operation rejected: code={}, message={}", e.getCode(), e.getMessage());
        return ResponseEntity.status(statusFor(e.getCode()))
            .body(ApiResponse.failure(e.getCode().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return ResponseEntity.badRequest()
            .body(ApiResponse.failure(VALIDATION_FAILED, "Request validation failed", errors));
    }

    @ExceptionHandler({
        MissingRequestHeaderException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(ApiResponse.failure(VALIDATION_FAILED, "Malformed request"));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Integrity violation: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(ApiResponse.failure("CONFLICT", "The request conflicts with existing state"));
    }

    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleTransientFailure(Exception e) {
        log.warn("Transient data access failure: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ApiResponse.failure(TRANSIENT_FAILURE, "Temporary failure, retry the request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.failure(INTERNAL_ERROR, "An unexpected error occurred"));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case RECIPIENT_NOT_FOUND, TRADE_NOT_FOUND, TIER_NOT_FOUND, SEASON_NOT_FOUND,
                 BALANCE_NOT_FOUND, ITEM_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_CLAIMED, ALREADY_PURCHASED, INVALID_TRADE -> HttpStatus.CONFLICT;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_FUNDS, INSUFFICIENT_QUANTITY, TIER_NOT_REACHED, BATTLE_PASS_REQUIRED,
                 ITEM_NOT_AVAILABLE, OUT_OF_STOCK, REQUIREMENT_NOT_MET -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
