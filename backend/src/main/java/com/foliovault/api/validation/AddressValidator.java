package com.foliovault.api.validation;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates and normalizes account and token addresses (EVM: 0x + 40 hex). Normalized form is lowercase, which is
 * the key every ledger store uses.
 */
@Component
public class AddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public static boolean isEvmAddress(String address) {
        return address != null && EVM_ADDRESS.matcher(address.trim()).matches();
    }

    public boolean isValidAddress(String address) {
        return isEvmAddress(address);
    }

    /**
     * @throws InvalidAddressException when {@code address} is missing or malformed
     */
    public String normalize(String address, String name) {
        if (!isEvmAddress(address)) {
            throw new InvalidAddressException(name + " must be an EVM address (0x + 40 hex characters)");
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
