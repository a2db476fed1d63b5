package com.foliovault.domain;

import com.foliovault.common.UintMath;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmountsTest {

    @Test
    void requirePositive_rejectsZeroAndNegative() {
        assertThatThrownBy(() -> Amounts.requirePositive(BigInteger.ZERO, "amount"))
                .isInstanceOf(LedgerException.class)
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.INVALID_ARGUMENT));
        assertThatThrownBy(() -> Amounts.requirePositive(BigInteger.valueOf(-3), "amount"))
                .isInstanceOf(LedgerException.class);
        assertThat(Amounts.requirePositive(BigInteger.TEN, "amount")).isEqualTo(BigInteger.TEN);
    }

    @Test
    void requireText_rejectsBlank() {
        assertThatThrownBy(() -> Amounts.requireText("  ", "symbol"))
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.INVALID_ARGUMENT));
    }

    @Test
    void arithmeticFailures_mapToLedgerCodes() {
        assertThatThrownBy(() -> Amounts.sub(BigInteger.ONE, BigInteger.TEN))
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.VALUE_UNDERFLOW));
        assertThatThrownBy(() -> Amounts.add(UintMath.MAX, BigInteger.ONE))
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.VALUE_OVERFLOW));
        assertThatThrownBy(() -> Amounts.mul(UintMath.MAX, BigInteger.TEN))
                .satisfies(e -> assertThat(((LedgerException) e).getErrorCode()).isEqualTo(LedgerErrorCode.VALUE_OVERFLOW));
    }

    @Test
    void ledgerRecord_keepsAttributeOrderAndStringifiesValues() {
        LedgerRecord record = LedgerRecord.of(LedgerEventType.STAKED, "0xabc", "amount", BigInteger.TEN, "stake", 25);
        assertThat(record.attributes()).containsExactly(
                org.assertj.core.api.Assertions.entry("amount", "10"),
                org.assertj.core.api.Assertions.entry("stake", "25"));
        assertThatThrownBy(() -> LedgerRecord.of(LedgerEventType.STAKED, "0xabc", "dangling"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
