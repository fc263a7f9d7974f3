package com.docflow.resilience;

import com.docflow.provider.ProviderException;

/**
 * A provider returned without a value. Never retried on the same provider.
 */
public final class InvalidProviderResponseException extends ProviderException {

    public InvalidProviderResponseException(String providerKey) {
        super("Provider " + providerKey + " returned no value");
    }
}
