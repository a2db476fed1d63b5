package com.foliovault.api.controller;

import com.foliovault.api.dto.ErrorBody;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps request validation failures (@Valid, unreadable bodies, bad path values) to 400 with ErrorBody.
 */
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ValidationExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter("INVALID_ADDRESS"::equals)
                .orElse("VALIDATION_ERROR");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, userFacingMessage(error, ex)));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        String message = ex.getReason() != null ? ex.getReason() : "Malformed request";
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", message));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "Invalid account or token address format";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
