package com.docflow.engine.build;

/**
 * Thrown when a flow definition cannot be built. The message joins every validation error with "; ".
 */
public final class BuildException extends RuntimeException {

    private final ValidationResult validationResult;

    public BuildException(ValidationResult validationResult) {
        super(validationResult != null ? String.join("; ", validationResult.getErrors()) : "Flow validation failed");
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
