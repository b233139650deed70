package com.txlens.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * EVM transaction hash: 0x + 64 hex.
 * Error code for API: INVALID_TX_HASH.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = TransactionHashValidator.class)
public @interface TransactionHash {

    String message() default "INVALID_TX_HASH";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
