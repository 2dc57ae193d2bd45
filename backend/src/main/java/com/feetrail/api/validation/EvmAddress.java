package com.feetrail.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Valid non-zero EVM address (0x + 40 hex). Error code for API: INVALID_ADDRESS.
 */
@Target({FIELD, PARAMETER, RECORD_COMPONENT})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = EvmAddressValidator.class)
public @interface EvmAddress {

    String message() default "INVALID_ADDRESS";

    /** Accept null / blank. */
    boolean optional() default false;

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
