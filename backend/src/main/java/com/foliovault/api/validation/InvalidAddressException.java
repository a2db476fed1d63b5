package com.foliovault.api.validation;

/**
 * Caller header or path address that is not a well-formed account address. Mapped to 400 INVALID_ADDRESS.
 */
public class InvalidAddressException extends RuntimeException {

    public InvalidAddressException(String message) {
        super(message);
    }
}
