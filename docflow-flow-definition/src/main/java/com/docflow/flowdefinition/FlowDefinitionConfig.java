package com.docflow.flowdefinition;

import com.docflow.flowdefinition.model.FlowDefinition;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serialization and deserialization of flow definitions and sub-flow registries.
 * JSON excludes null values when serializing. A single string is accepted where a list of
 * step ids is expected (e.g. output {@code "source": "extract"}).
 */
public final class FlowDefinitionConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<LinkedHashMap<String, FlowDefinition>> REGISTRY_TYPE = new TypeReference<>() {};

    private FlowDefinitionConfig() {
    }

    /**
     * Deserializes a flow definition from a JSON string.
     *
     * @param json the JSON string (e.g. from file or API)
     * @return the parsed {@link FlowDefinition}
     * @throws UncheckedIOException on parse failure (including unknown step types)
     */
    public static FlowDefinition fromJson(String json) {
        try {
            return MAPPER.readValue(json, FlowDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes a flow definition to JSON (nulls excluded).
     */
    public static String toJson(FlowDefinition flow) {
        try {
            return MAPPER.writeValueAsString(flow);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * Deserializes a sub-flow registry: a JSON object of flow id to flow definition.
     * Iteration order of the returned map follows the JSON document.
     */
    public static Map<String, FlowDefinition> subFlowsFromJson(String json) {
        try {
            Map<String, FlowDefinition> flows = MAPPER.readValue(json, REGISTRY_TYPE);
            return flows != null ? flows : Map.of();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Serializes a sub-flow registry (flow id to definition). */
    public static String subFlowsToJson(Map<String, FlowDefinition> flows) {
        try {
            return MAPPER.writeValueAsString(flows != null ? flows : Map.of());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
