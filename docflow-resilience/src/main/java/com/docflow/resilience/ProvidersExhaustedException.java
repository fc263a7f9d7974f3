package com.docflow.resilience;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every provider of a fallback chain failed or was skipped. Lists each provider with its last error.
 */
public final class ProvidersExhaustedException extends RuntimeException {

    private final String stepId;
    private final List<ProviderFailure> failures;

    public ProvidersExhaustedException(String stepId, List<ProviderFailure> failures) {
        super(buildMessage(failures), lastError(failures));
        this.stepId = stepId;
        this.failures = List.copyOf(failures);
    }

    private static String buildMessage(List<ProviderFailure> failures) {
        return "All providers failed:\n" + failures.stream()
                .map(f -> "  " + f.providerKey() + ": " + f.describe())
                .collect(Collectors.joining("\n"));
    }

    private static Throwable lastError(List<ProviderFailure> failures) {
        for (int i = failures.size() - 1; i >= 0; i--) {
            if (failures.get(i).lastError() != null) return failures.get(i).lastError();
        }
        return null;
    }

    public String getStepId() {
        return stepId;
    }

    public List<ProviderFailure> getFailures() {
        return failures;
    }
}
