package com.txlens.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Validates transaction hash format for Jakarta Bean Validation.
 * Delegates to TxInputValidator for a single source of truth.
 */
@Component
public class TransactionHashValidator implements ConstraintValidator<TransactionHash, String> {

    private final TxInputValidator txInputValidator;

    public TransactionHashValidator(TxInputValidator txInputValidator) {
        this.txInputValidator = txInputValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return txInputValidator.isValidTxHash(value);
    }
}
