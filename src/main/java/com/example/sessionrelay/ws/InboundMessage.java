package com.example.sessionrelay.ws;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A decoded client message. {@code requestId} is null for types that do not carry one.
 */
public final class InboundMessage {
    private final MessageType type;
    private final String requestId;
    private final JsonNode root;

    InboundMessage(MessageType type, String requestId, JsonNode root) {
        this.type = type;
        this.requestId = requestId;
        this.root = root;
    }

    public MessageType getType() { return type; }
    public String getRequestId() { return requestId; }
    public JsonNode getRoot() { return root; }

    public String text(String field) {
        JsonNode n = root.get(field);
        return (n == null || n.isNull()) ? null : n.asText();
    }
}
