package com.docflow.provider;

/**
 * Base contract for a provider backend. Implementations are {@link OcrProvider} or {@link VlmProvider}.
 * <p>
 * Instances are shared by every step (and every concurrent forEach item) bound to them;
 * implement as thread-safe.
 */
public interface ProviderInstance {

    ProviderIdentity identity();

    ProviderCapability capability();
}
