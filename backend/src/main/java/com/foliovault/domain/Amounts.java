package com.foliovault.domain;

import com.foliovault.common.UintMath;

import java.math.BigInteger;

/**
 * Argument checks and checked arithmetic for ledger amounts, failing with {@link LedgerException}.
 */
public final class Amounts {

    private Amounts() {
    }

    public static BigInteger requireUint(BigInteger value, String name) {
        if (!UintMath.isUint(value)) {
            throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, name + " must be a non-negative uint256, got " + value);
        }
        return value;
    }

    public static BigInteger requirePositive(BigInteger value, String name) {
        requireUint(value, name);
        if (value.signum() == 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, name + " must be greater than zero");
        }
        return value;
    }

    public static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, name + " is required");
        }
        return value;
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        try {
            return UintMath.add(a, b);
        } catch (ArithmeticException e) {
            throw new LedgerException(LedgerErrorCode.VALUE_OVERFLOW, e.getMessage(), e);
        }
    }

    public static BigInteger sub(BigInteger a, BigInteger b) {
        try {
            return UintMath.sub(a, b);
        } catch (ArithmeticException e) {
            throw new LedgerException(LedgerErrorCode.VALUE_UNDERFLOW, e.getMessage(), e);
        }
    }

    public static BigInteger mul(BigInteger a, BigInteger b) {
        try {
            return UintMath.mul(a, b);
        } catch (ArithmeticException e) {
            throw new LedgerException(LedgerErrorCode.VALUE_OVERFLOW, e.getMessage(), e);
        }
    }

    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger divisor) {
        try {
            return UintMath.mulDiv(a, b, divisor);
        } catch (ArithmeticException e) {
            throw new LedgerException(LedgerErrorCode.VALUE_OVERFLOW, e.getMessage(), e);
        }
    }

    public static BigInteger percentOf(BigInteger value, BigInteger percent) {
        return mulDiv(value, percent, UintMath.HUNDRED);
    }
}
