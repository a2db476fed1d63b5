package com.foliovault.common;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Unsigned 256-bit integer helpers. Amounts, values and balances in the ledger are never negative and
 * never exceed {@link #MAX}; callers translate the {@link ArithmeticException} into a domain error.
 */
public final class UintMath {

    public static final BigInteger MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
    public static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private UintMath() {
    }

    public static boolean isUint(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(MAX) <= 0;
    }

    public static boolean isPositive(BigInteger value) {
        return value != null && value.signum() > 0;
    }

    public static BigInteger add(BigInteger a, BigInteger b) {
        BigInteger sum = Objects.requireNonNull(a).add(Objects.requireNonNull(b));
        if (sum.compareTo(MAX) > 0) {
            throw new ArithmeticException("uint256 overflow: " + a + " + " + b);
        }
        return sum;
    }

    public static BigInteger sub(BigInteger a, BigInteger b) {
        BigInteger diff = Objects.requireNonNull(a).subtract(Objects.requireNonNull(b));
        if (diff.signum() < 0) {
            throw new ArithmeticException("uint256 underflow: " + a + " - " + b);
        }
        return diff;
    }

    public static BigInteger mul(BigInteger a, BigInteger b) {
        BigInteger product = Objects.requireNonNull(a).multiply(Objects.requireNonNull(b));
        if (product.compareTo(MAX) > 0) {
            throw new ArithmeticException("uint256 overflow: " + a + " * " + b);
        }
        return product;
    }

    /**
     * Truncating division ({@code a * b / divisor}), rounding toward zero.
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger divisor) {
        if (divisor.signum() == 0) {
            throw new ArithmeticException("division by zero");
        }
        return mul(a, b).divide(divisor);
    }
}
