package com.docflow.provider;

import java.util.Objects;

/**
 * Vendor and model of a provider instance. {@link #key()} ({@code vendor:model}) identifies the
 * circuit breaker shared by every ref pointing at the same backend.
 */
public record ProviderIdentity(String vendor, String model) {

    public ProviderIdentity {
        Objects.requireNonNull(vendor, "vendor");
        vendor = vendor.trim();
        model = model != null && !model.isBlank() ? model.trim() : "default";
    }

    public String key() {
        return vendor + ":" + model;
    }

    @Override
    public String toString() {
        return key();
    }
}
