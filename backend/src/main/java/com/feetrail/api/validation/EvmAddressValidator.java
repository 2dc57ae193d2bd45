package com.feetrail.api.validation;

import com.feetrail.common.EvmHex;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    private boolean optional;

    @Override
    public void initialize(EvmAddress annotation) {
        this.optional = annotation.optional();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isBlank()) {
            return optional;
        }
        return EvmHex.isNonZeroAddress(value.trim());
    }
}
