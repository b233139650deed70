package com.txlens.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

@Component
public class SupportedNetworkValidator implements ConstraintValidator<SupportedNetwork, Long> {

    private final TxInputValidator txInputValidator;

    public SupportedNetworkValidator(TxInputValidator txInputValidator) {
        this.txInputValidator = txInputValidator;
    }

    @Override
    public boolean isValid(Long value, ConstraintValidatorContext context) {
        return txInputValidator.isSupportedNetwork(value);
    }
}
