package com.txlens.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Chain id of a supported NetworkId.
 * Error code for API: INVALID_NETWORK.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = SupportedNetworkValidator.class)
public @interface SupportedNetwork {

    String message() default "INVALID_NETWORK";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
