package com.docflow.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup of provider instances by ref. Built once with {@link #builder()}; a flow build
 * resolves every ref against it so nothing is looked up by string at run time.
 */
public final class ProviderRegistry {

    private static final ProviderRegistry EMPTY = new ProviderRegistry(Map.of());

    private final Map<String, ProviderInstance> providers;

    private ProviderRegistry(Map<String, ProviderInstance> providers) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    public static ProviderRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ProviderInstance> find(String ref) {
        if (ref == null) return Optional.empty();
        return Optional.ofNullable(providers.get(ref.trim()));
    }

    public boolean contains(String ref) {
        return find(ref).isPresent();
    }

    public Set<String> refs() {
        return providers.keySet();
    }

    public int size() {
        return providers.size();
    }

    /**
     * Returns a registry in which each key of {@code overrides} (a ref used by a child flow) resolves to
     * this registry's instance for the mapped value (a parent ref). Refs not overridden are unchanged.
     *
     * @throws IllegalArgumentException if a parent ref is not registered
     */
    public ProviderRegistry withOverrides(Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        Map<String, ProviderInstance> merged = new LinkedHashMap<>(providers);
        for (Map.Entry<String, String> e : overrides.entrySet()) {
            ProviderInstance target = find(e.getValue())
                    .orElseThrow(() -> new IllegalArgumentException("Override target not registered: " + e.getValue()));
            merged.put(e.getKey().trim(), target);
        }
        return new ProviderRegistry(merged);
    }

    @Override
    public String toString() {
        return "ProviderRegistry" + providers.keySet();
    }

    public static final class Builder {
        private final Map<String, ProviderInstance> providers = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if ref is blank or already registered
         */
        public Builder register(String ref, ProviderInstance provider) {
            Objects.requireNonNull(provider, "provider");
            String id = Objects.requireNonNull(ref, "ref").trim();
            if (id.isEmpty()) {
                throw new IllegalArgumentException("Provider ref must be non-blank");
            }
            if (providers.putIfAbsent(id, provider) != null) {
                throw new IllegalArgumentException("Provider already registered: " + id);
            }
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(providers);
        }
    }
}
