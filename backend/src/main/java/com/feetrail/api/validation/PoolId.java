package com.feetrail.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Valid pool id: 0x + 64 hex. Error code for API: INVALID_POOL_ID.
 */
@Target({FIELD, PARAMETER, RECORD_COMPONENT})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = PoolIdValidator.class)
public @interface PoolId {

    String message() default "INVALID_POOL_ID";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
