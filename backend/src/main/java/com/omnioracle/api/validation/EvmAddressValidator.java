package com.omnioracle.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

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
        return isEvmAddress(value);
    }

    public static boolean isEvmAddress(String value) {
        return value != null && EVM_ADDRESS.matcher(value.trim()).matches();
    }
}
