package com.omnioracle.api.controller;

import com.omnioracle.api.dto.ErrorBody;
import com.omnioracle.domain.OracleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps validation failures and {@link OracleException} codes to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(OracleException.class)
    public ResponseEntity<ErrorBody> handleOracle(OracleException ex) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            log.warn("Request failed [{}]: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getCode(), ex.getMessage()));
    }

    static HttpStatus statusFor(String code) {
        return switch (code) {
            case "INVALID_CONFIGURATION", "UNSUPPORTED_SELECTOR" -> HttpStatus.BAD_REQUEST;
            case "MODE_VIOLATION", "EMERGENCY_ACTIVE", "READ_CHANNEL_UNSET", "PEER_INACTIVE", "PEER_REF_UNSET" ->
                    HttpStatus.CONFLICT;
            case "INSUFFICIENT_SOURCES", "RATIO_UNAVAILABLE", "CIRCUIT_BREAKER_OPEN", "DEVIATION_EXCEEDED" ->
                    HttpStatus.SERVICE_UNAVAILABLE;
            case "PAYLOAD_INVALID" -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "Invalid EVM address format";
            case "INVALID_PRICE" -> "Price must be a positive 18-decimal fixed-point integer";
            case "INVALID_WEIGHT" -> "Weight must be in 0..255";
            case "INVALID_MIN_SOURCES" -> "minValidSources must be in 1..4";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
