package com.docflow.resilience;

import com.docflow.provider.ProviderException;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a provider failure is worth retrying, from the HTTP status of a
 * {@link ProviderException}, transport exception types, and message heuristics
 * (status codes, timeouts, rate limits, overload, connection errors). The cause chain is inspected.
 */
public final class RetryableErrorClassifier {

    private static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);

    private static final List<String> RETRYABLE_MESSAGE_PATTERNS = List.of(
            "timeout", "timed out", "rate limit", "overloaded",
            "econnreset", "etimedout", "enotfound", "econnrefused",
            "socket hang up", "network error", "connection reset");

    private static final Pattern STATUS_CODE = Pattern.compile("\\b([45]\\d{2})\\b");
    private static final Pattern RETRY_AFTER = Pattern.compile("retry-after[:\\s]+(\\d+)", Pattern.CASE_INSENSITIVE);

    /** Retry-After values at or above this many seconds are ignored. */
    private static final long MAX_RETRY_AFTER_SECONDS = 3600L;
    private static final int MAX_CAUSE_DEPTH = 5;

    private RetryableErrorClassifier() {
    }

    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof InvalidProviderResponseException) return false;
            if (current instanceof ProviderException pe && pe.getStatusCode() != null) {
                return RETRYABLE_STATUS_CODES.contains(pe.getStatusCode());
            }
            if (current instanceof InterruptedIOException
                    || current instanceof ConnectException
                    || current instanceof TimeoutException) {
                return true;
            }
            if (messageLooksRetryable(current.getMessage())) return true;
            current = current.getCause() != current ? current.getCause() : null;
        }
        return false;
    }

    /**
     * HTTP status of the failure: {@link ProviderException#getStatusCode()} when set, else the first
     * 4xx/5xx number found in the message. Null when none.
     */
    public static Integer extractStatusCode(Throwable error) {
        if (error == null) return null;
        if (error instanceof ProviderException pe && pe.getStatusCode() != null) {
            return pe.getStatusCode();
        }
        String message = error.getMessage();
        if (message == null) return null;
        Matcher m = STATUS_CODE.matcher(message);
        return m.find() ? Integer.valueOf(m.group(1)) : null;
    }

    /**
     * Server-requested wait in milliseconds: {@link ProviderException#getRetryAfterMs()} when positive, else a
     * {@code retry-after: N} (seconds, 0 &lt; N &lt; 3600) found in the message. Null when absent.
     */
    public static Long retryAfterMs(Throwable error) {
        if (error == null) return null;
        if (error instanceof ProviderException pe && pe.getRetryAfterMs() != null && pe.getRetryAfterMs() > 0) {
            return pe.getRetryAfterMs();
        }
        String message = error.getMessage();
        if (message == null) return null;
        Matcher m = RETRY_AFTER.matcher(message);
        if (!m.find()) return null;
        try {
            long seconds = Long.parseLong(m.group(1));
            return seconds > 0 && seconds < MAX_RETRY_AFTER_SECONDS ? seconds * 1000L : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean messageLooksRetryable(String message) {
        if (message == null || message.isBlank()) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        for (String pattern : RETRYABLE_MESSAGE_PATTERNS) {
            if (lower.contains(pattern)) return true;
        }
        Matcher m = STATUS_CODE.matcher(lower);
        while (m.find()) {
            if (RETRYABLE_STATUS_CODES.contains(Integer.valueOf(m.group(1)))) return true;
        }
        return false;
    }
}
