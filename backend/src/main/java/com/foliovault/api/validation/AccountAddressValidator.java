package com.foliovault.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Bean Validation side of {@link AddressValidator}; shares its pattern.
 */
public class AccountAddressValidator implements ConstraintValidator<AccountAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return AddressValidator.isEvmAddress(value);
    }
}
