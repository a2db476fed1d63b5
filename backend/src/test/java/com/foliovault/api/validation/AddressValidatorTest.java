package com.foliovault.api.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AddressValidatorTest {

    private final AddressValidator validator = new AddressValidator();

    @Test
    @DisplayName("Valid EVM address accepted")
    void validEvmAddress() {
        assertThat(validator.isValidAddress("0x742d35Cc6634C0532925a3b844Bc454e4438f44e")).isTrue();
        assertThat(validator.isValidAddress("0x0000000000000000000000000000000000000000")).isTrue();
    }

    @Test
    @DisplayName("Invalid address rejected")
    void invalidAddress() {
        assertThat(validator.isValidAddress(null)).isFalse();
        assertThat(validator.isValidAddress("")).isFalse();
        assertThat(validator.isValidAddress("0x123")).isFalse();
        assertThat(validator.isValidAddress("nothex")).isFalse();
    }

    @Test
    @DisplayName("normalize trims and lowercases")
    void normalize() {
        assertThat(validator.normalize(" 0x742d35Cc6634C0532925a3b844Bc454e4438f44e ", "owner"))
                .isEqualTo("0x742d35cc6634c0532925a3b844bc454e4438f44e");
    }

    @Test
    @DisplayName("normalize names the offending parameter")
    void normalizeRejects() {
        assertThatThrownBy(() -> validator.normalize(null, "X-Account"))
                .isInstanceOf(InvalidAddressException.class)
                .hasMessageContaining("X-Account");
    }

    @Test
    @DisplayName("constraint validator shares the pattern")
    void constraintValidator() {
        AccountAddressValidator constraint = new AccountAddressValidator();
        assertThat(constraint.isValid("0x742d35Cc6634C0532925a3b844Bc454e4438f44e", null)).isTrue();
        assertThat(constraint.isValid("0x742d", null)).isFalse();
    }
}
