package com.docflow.resilience;

/**
 * How one provider of a chain failed. {@code skipped} providers had an open circuit breaker and were
 * not attempted ({@code attempts} is 0, {@code lastError} null).
 */
public record ProviderFailure(String providerKey, int attempts, Throwable lastError, boolean skipped) {

    public static ProviderFailure skipped(String providerKey) {
        return new ProviderFailure(providerKey, 0, null, true);
    }

    public String describe() {
        if (skipped) return "circuit breaker open";
        String message = lastError != null && lastError.getMessage() != null
                ? lastError.getMessage() : String.valueOf(lastError);
        return message + " (attempts: " + attempts + ")";
    }
}
