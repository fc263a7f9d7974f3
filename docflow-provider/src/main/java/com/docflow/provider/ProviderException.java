package com.docflow.provider;

/**
 * Failure reported by a provider adapter. {@code statusCode} is the HTTP status when the failure came
 * from an HTTP response; {@code retryAfterMs} is the server's Retry-After hint. Both are optional.
 */
public class ProviderException extends RuntimeException {

    private final Integer statusCode;
    private final Long retryAfterMs;

    public ProviderException(String message) {
        this(message, null, null, null);
    }

    public ProviderException(String message, Integer statusCode) {
        this(message, statusCode, null, null);
    }

    public ProviderException(String message, Integer statusCode, Long retryAfterMs, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public Long getRetryAfterMs() {
        return retryAfterMs;
    }
}
