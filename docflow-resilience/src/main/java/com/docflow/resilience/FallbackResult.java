package com.docflow.resilience;

import com.docflow.provider.ProviderInstance;
import com.docflow.provider.ProviderResponse;

/**
 * Successful outcome of {@link FallbackManager#callWithFallback}.
 *
 * @param providerIndex position of the answering provider in the chain (0 = primary)
 * @param attemptNumber attempt on that provider that succeeded, starting at 1
 */
public record FallbackResult(ProviderResponse response, ProviderInstance provider, int providerIndex, int attemptNumber) {

    public String providerKey() {
        return provider.identity().key();
    }
}
