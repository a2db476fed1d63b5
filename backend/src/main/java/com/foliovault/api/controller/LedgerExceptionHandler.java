package com.foliovault.api.controller;

import com.foliovault.api.dto.ErrorBody;
import com.foliovault.api.validation.InvalidAddressException;
import com.foliovault.domain.LedgerErrorCode;
import com.foliovault.domain.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps rejected ledger operations to ErrorBody; the error field is the {@link LedgerErrorCode} name.
 */
@RestControllerAdvice
@Slf4j
public class LedgerExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorBody> handleLedger(LedgerException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        log.debug("Ledger operation rejected with {}: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ErrorBody> handleInvalidAddress(InvalidAddressException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", ex.getMessage()));
    }

    static HttpStatus statusOf(LedgerErrorCode code) {
        return switch (code) {
            case NOT_OWNER -> HttpStatus.FORBIDDEN;
            case ASSET_NOT_FOUND, NO_ORACLE, UNKNOWN_TOKEN -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS, ALREADY_BOUND, ALREADY_EXECUTED, VOTING_CLOSED, POLICY_INACTIVE -> HttpStatus.CONFLICT;
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }
}
