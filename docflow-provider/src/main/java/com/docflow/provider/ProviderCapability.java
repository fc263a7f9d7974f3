package com.docflow.provider;

/**
 * What a provider instance can be invoked as. An instance is never both.
 */
public enum ProviderCapability {
    /** Raw document to structured document. */
    OCR,
    /** Document plus schema to structured JSON. */
    VLM
}
