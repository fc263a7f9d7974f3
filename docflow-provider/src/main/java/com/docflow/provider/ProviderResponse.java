package com.docflow.provider;

/**
 * Normalized provider response. {@code model} is the model that actually answered (may differ from the
 * configured one); null when the provider does not report it.
 */
public record ProviderResponse(Object value, long tokensIn, long tokensOut, double costUsd, String model) {

    public static ProviderResponse of(Object value) {
        return new ProviderResponse(value, 0, 0, 0.0, null);
    }

    public static ProviderResponse of(Object value, long tokensIn, long tokensOut, double costUsd) {
        return new ProviderResponse(value, tokensIn, tokensOut, costUsd, null);
    }
}
