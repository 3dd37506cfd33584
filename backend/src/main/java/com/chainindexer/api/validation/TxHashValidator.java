package com.chainindexer.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

public class TxHashValidator implements ConstraintValidator<TxHash, String> {

    private static final Pattern TX_HASH = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && TX_HASH.matcher(value).matches();
    }
}
