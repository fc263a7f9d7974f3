package com.docflow.engine;

/**
 * Input of a flow run. {@code mimeType} is declared by the caller and only used for input validation.
 */
public record FlowInput(Object document, String mimeType) {

    public static FlowInput of(Object document) {
        return new FlowInput(document, null);
    }
}
