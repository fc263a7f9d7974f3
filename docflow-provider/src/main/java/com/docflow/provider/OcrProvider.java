package com.docflow.provider;

/**
 * OCR-style provider: turns a raw document into a structured document.
 */
public interface OcrProvider extends ProviderInstance {

    /**
     * Parses the document.
     *
     * @param document the document or the previous step's output
     * @return response; {@link ProviderResponse#value()} must be non-null
     * @throws Exception on provider failure (message is classified for retryability)
     */
    ProviderResponse parse(Object document) throws Exception;

    @Override
    default ProviderCapability capability() {
        return ProviderCapability.OCR;
    }
}
