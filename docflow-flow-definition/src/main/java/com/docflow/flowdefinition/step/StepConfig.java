package com.docflow.flowdefinition.step;

import com.docflow.flowdefinition.consensus.ConsensusConfig;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider binding and call options of a provider-backed step (standard step, conditional
 * classifier, forEach splitter). {@code fallbackProviderRefs} are tried in order after the primary.
 */
public final class StepConfig {

    private final String providerRef;
    private final List<String> fallbackProviderRefs;
    private final Map<String, Object> schema;
    private final List<String> categories;
    private final ConsensusConfig consensus;
    private final Integer maxTokens;

    @JsonCreator
    public StepConfig(
            @JsonProperty("providerRef") String providerRef,
            @JsonProperty("fallbackProviderRefs") List<String> fallbackProviderRefs,
            @JsonProperty("schema") Map<String, Object> schema,
            @JsonProperty("categories") List<String> categories,
            @JsonProperty("consensus") ConsensusConfig consensus,
            @JsonProperty("maxTokens") Integer maxTokens) {
        this.providerRef = providerRef;
        this.fallbackProviderRefs = fallbackProviderRefs != null ? List.copyOf(fallbackProviderRefs) : List.of();
        this.schema = schema != null ? Collections.unmodifiableMap(new LinkedHashMap<>(schema)) : null;
        this.categories = categories != null ? List.copyOf(categories) : List.of();
        this.consensus = consensus;
        this.maxTokens = maxTokens;
    }

    public static StepConfig provider(String providerRef) {
        return new StepConfig(providerRef, null, null, null, null, null);
    }

    public String getProviderRef() {
        return providerRef;
    }

    public List<String> getFallbackProviderRefs() {
        return fallbackProviderRefs;
    }

    /** Primary ref followed by fallbacks (blank primary omitted). */
    @JsonIgnore
    public List<String> getProviderChain() {
        List<String> chain = new ArrayList<>();
        if (providerRef != null && !providerRef.isBlank()) chain.add(providerRef);
        chain.addAll(fallbackProviderRefs);
        return List.copyOf(chain);
    }

    /** JSON schema passed to VLM providers; null when not set. */
    public Map<String, Object> getSchema() {
        return schema;
    }

    public List<String> getCategories() {
        return categories;
    }

    public ConsensusConfig getConsensus() {
        return consensus;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public StepConfig withFallbacks(List<String> refs) {
        return new StepConfig(providerRef, refs, schema, categories, consensus, maxTokens);
    }

    public StepConfig withConsensus(ConsensusConfig config) {
        return new StepConfig(providerRef, fallbackProviderRefs, schema, categories, config, maxTokens);
    }

    public StepConfig withSchema(Map<String, Object> value) {
        return new StepConfig(providerRef, fallbackProviderRefs, value, categories, consensus, maxTokens);
    }

    public StepConfig withCategories(List<String> value) {
        return new StepConfig(providerRef, fallbackProviderRefs, schema, value, consensus, maxTokens);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepConfig that = (StepConfig) o;
        return Objects.equals(providerRef, that.providerRef)
                && Objects.equals(fallbackProviderRefs, that.fallbackProviderRefs)
                && Objects.equals(schema, that.schema)
                && Objects.equals(categories, that.categories)
                && Objects.equals(consensus, that.consensus)
                && Objects.equals(maxTokens, that.maxTokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(providerRef, fallbackProviderRefs, schema, categories, consensus, maxTokens);
    }
}
