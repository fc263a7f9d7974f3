package com.docflow.resilience;

import com.docflow.provider.ProviderInstance;
import com.docflow.provider.ProviderResponse;

/**
 * One attempt against one provider of a fallback chain.
 */
@FunctionalInterface
public interface ProviderCall {

    ProviderResponse invoke(ProviderInstance provider) throws Exception;
}
