package com.foliovault.domain;

import lombok.Getter;

/**
 * Structured rejection of a ledger transition. API layer (LedgerExceptionHandler) maps the code to an HTTP status.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    public LedgerException(LedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(LedgerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
