package com.docflow.provider;

/**
 * VLM-style provider: document plus schema to a structured value. Serves extract, split and categorize steps.
 */
public interface VlmProvider extends ProviderInstance {

    /**
     * @param request operation, input, schema and options
     * @return response; {@link ProviderResponse#value()} must be non-null
     * @throws Exception on provider failure (message is classified for retryability)
     */
    ProviderResponse complete(VlmRequest request) throws Exception;

    @Override
    default ProviderCapability capability() {
        return ProviderCapability.VLM;
    }
}
