package com.feetrail.api.validation;

import com.feetrail.common.EvmHex;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class PoolIdValidator implements ConstraintValidator<PoolId, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && EvmHex.isBytes32(value.trim());
    }
}
