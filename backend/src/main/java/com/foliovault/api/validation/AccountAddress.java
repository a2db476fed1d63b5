package com.foliovault.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * EVM account or token address (0x + 40 hex). Error code for API: INVALID_ADDRESS.
 */
@Target({FIELD, PARAMETER, RECORD_COMPONENT, TYPE_USE})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = AccountAddressValidator.class)
public @interface AccountAddress {

    String message() default "INVALID_ADDRESS";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
