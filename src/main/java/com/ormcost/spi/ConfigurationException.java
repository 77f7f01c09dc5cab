package com.ormcost.spi;

/**
 * Exception thrown when the engine or one of its integration hooks is configured incorrectly.
 * The engine cannot run without a valid configuration, so this is raised at construction time.
 */
public class ConfigurationException extends OrmCostException {

    private final ValidationResult validationResult;

    public ConfigurationException(String message) {
        super(message);
        this.validationResult = ValidationResult.failure("config", message);
    }

    public ConfigurationException(ValidationResult validationResult) {
        super("Configuration validation failed: " + validationResult.allErrorMessages());
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
