package com.flagship.wallet_ledger.api.validation;

import com.flagship.wallet_ledger.ledger.TransferCommand;

import java.util.Map;

/**
 * Outcome of validating a transfer request: either a command ready for the
 * coordinator, or the field errors that prevented building one.
 */
public final class ValidationResult {

    private final TransferCommand command;
    private final Map<String, String> errors;

    private ValidationResult(TransferCommand command, Map<String, String> errors) {
        this.command = command;
        this.errors = errors;
    }

    public static ValidationResult valid(TransferCommand command) {
        return new ValidationResult(command, Map.of());
    }

    public static ValidationResult invalid(Map<String, String> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An invalid result needs at least one error");
        }
        return new ValidationResult(null, Map.copyOf(errors));
    }

    public boolean isValid() {
        return command != null;
    }

    /**
     * @throws IllegalStateException if the result is invalid
     */
    public TransferCommand getCommand() {
        if (command == null) {
            throw new IllegalStateException("No command on an invalid result: " + errors);
        }
        return command;
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
