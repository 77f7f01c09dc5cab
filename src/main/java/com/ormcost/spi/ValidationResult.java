package com.ormcost.spi;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of validating a configuration: either valid, or a list of field-level errors.
 */
public record ValidationResult(List<ValidationError> errors) {

    public ValidationResult {
        Objects.requireNonNull(errors, "errors must not be null");
        errors = List.copyOf(errors);
    }

    public static ValidationResult success() {
        return new ValidationResult(List.of());
    }

    public static ValidationResult failure(String field, String message) {
        return new ValidationResult(List.of(new ValidationError(field, message)));
    }

    public static ValidationResult failure(List<ValidationError> errors) {
        return new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean isInvalid() {
        return !errors.isEmpty();
    }

    /**
     * Returns all error messages joined for display, each prefixed by its field.
     */
    public String allErrorMessages() {
        return errors.stream()
                .map(e -> e.field() + ": " + e.message())
                .collect(Collectors.joining("; "));
    }

    /**
     * Throws {@link ConfigurationException} when this result is invalid.
     */
    public void throwIfInvalid() {
        if (isInvalid()) {
            throw new ConfigurationException(this);
        }
    }

    public record ValidationError(String field, String message) {
        public ValidationError {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }
}
