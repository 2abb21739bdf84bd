package com.flagship.wallet_ledger.api.validation;

import com.flagship.wallet_ledger.api.dto.TransferRequestBody;
import com.flagship.wallet_ledger.ledger.TransferCommand;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a request body into a {@link TransferCommand} or a set of field errors.
 * Field names in the errors are the JSON property names the client sent.
 */
@Component
public class TransferRequestValidator {

    private static final Map<String, String> JSON_FIELD_NAMES = Map.of(
        "userId", "user_id",
        "assetTypeId", "asset_type_id",
        "amount", "amount",
        "idempotencyKey", "idempotency_key",
        "description", "description"
    );

    private final Validator validator;

    public TransferRequestValidator(Validator validator) {
        this.validator = validator;
    }

    public ValidationResult validate(TransferRequestBody body) {
        if (body == null) {
            return ValidationResult.invalid(Map.of("body", "Request body is required"));
        }

        Set<ConstraintViolation<TransferRequestBody>> violations = validator.validate(body);
        if (!violations.isEmpty()) {
            Map<String, String> errors = new TreeMap<>();
            for (ConstraintViolation<TransferRequestBody> violation : violations) {
                String property = violation.getPropertyPath().toString();
                errors.merge(JSON_FIELD_NAMES.getOrDefault(property, property), violation.getMessage(),
                    (first, second) -> first);
            }
            return ValidationResult.invalid(errors);
        }

        return ValidationResult.valid(TransferCommand.builder()
            .userId(body.getUserId())
            .assetTypeId(body.getAssetTypeId())
            .amount(body.getAmount())
            .idempotencyKey(body.getIdempotencyKey())
            .description(body.getDescription())
            .build());
    }
}
