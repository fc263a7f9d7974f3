package com.docflow.flowdefinition.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Deserializes a branch or item flow as either {@code {"flowRef": "id"}} or an inline flow object.
 */
public final class FlowOrRefDeserializer extends JsonDeserializer<FlowOrRef> {

    @Override
    public FlowOrRef deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || !node.isObject()) {
            return ctxt.reportInputMismatch(FlowOrRef.class,
                    "Expected an inline flow or {\"flowRef\": ...}, got %s", node != null ? node.getNodeType() : "null");
        }
        JsonNode ref = node.get("flowRef");
        if (ref != null && ref.isTextual()) {
            return FlowOrRef.ref(ref.asText());
        }
        return FlowOrRef.inline(p.getCodec().treeToValue(node, FlowDefinition.class));
    }
}
