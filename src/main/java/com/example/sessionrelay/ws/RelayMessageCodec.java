package com.example.sessionrelay.ws;

import com.example.sessionrelay.exception.GatewayException;
import com.example.sessionrelay.model.BuiltRequest;
import com.example.sessionrelay.model.GatewayErrorKind;
import com.example.sessionrelay.model.LogicalRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON envelope {@code {"type": ..., "request_id": ..., ...}} in both directions.
 * Decoding failures are {@link GatewayErrorKind#PROTOCOL_ERROR}.
 */
@Component
public class RelayMessageCodec {

    private final ObjectMapper om = new ObjectMapper();

    public InboundMessage decode(String payload) {
        JsonNode root;
        try {
            root = om.readTree(payload);
        } catch (JsonProcessingException e) {
            throw protocol("Malformed JSON");
        }
        if (root == null || !root.isObject()) throw protocol("Message must be a JSON object");

        String typeStr = root.path("type").asText("");
        if (typeStr.isEmpty()) throw protocol("Message type missing");

        MessageType type = MessageType.fromWire(typeStr)
                .orElseThrow(() -> protocol("Unknown message type: " + typeStr));
        if (!type.isFromClient()) throw protocol("Message type not accepted from client: " + typeStr);

        JsonNode rid = root.get("request_id");
        String requestId = (rid == null || rid.isNull()) ? null : rid.asText();
        if (type == MessageType.RESPONSE) {
            if (requestId == null || requestId.isBlank()) throw protocol("response without request_id");
            if (!hasOutcome(root)) throw protocol("response without success flag");
        }
        return new InboundMessage(type, requestId, root);
    }

    /**
     * Outcome of a response message: boolean {@code success}, or the older {@code status: "success"|"error"} form.
     */
    public boolean isSuccess(InboundMessage msg) {
        JsonNode root = msg.getRoot();
        JsonNode s = root.get("success");
        if (s != null && s.isBoolean()) return s.booleanValue();
        return "success".equals(root.path("status").asText(""));
    }

    private static boolean hasOutcome(JsonNode root) {
        JsonNode s = root.get("success");
        if (s != null && s.isBoolean()) return true;
        String status = root.path("status").asText("");
        return "success".equals(status) || "error".equals(status);
    }

    public String request(String requestId, LogicalRequest request, BuiltRequest http) {
        ObjectNode root = om.createObjectNode();
        root.put("type", MessageType.REQUEST.wire());
        root.put("request_id", requestId);
        root.put("endpoint", request.getEndpoint());
        root.set("params", om.valueToTree(request.getParams()));
        if (http != null) {
            ObjectNode h = root.putObject("http");
            h.put("method", http.getMethod());
            h.put("url", http.getUrl());
            ObjectNode headers = h.putObject("headers");
            for (BuiltRequest.Header header : http.getHeaders()) {
                headers.put(header.getName(), header.getValue());
            }
            if (http.getBody() != null) h.put("body", http.getBody());
            h.put("include_credentials", true);
        }
        return write(root);
    }

    public String ping(long id) {
        ObjectNode root = om.createObjectNode();
        root.put("type", MessageType.PING.wire());
        root.put("id", id);
        return write(root);
    }

    public String pong(JsonNode id, long serverTimeEpochMs) {
        ObjectNode root = om.createObjectNode();
        root.put("type", MessageType.PONG.wire());
        if (id != null && !id.isNull()) root.set("id", id);
        root.put("server_time", serverTimeEpochMs);
        return write(root);
    }

    public String authSuccess(String userId) {
        ObjectNode root = om.createObjectNode();
        root.put("type", MessageType.AUTH_SUCCESS.wire());
        root.put("user_id", userId);
        return write(root);
    }

    public String error(String message, Integer code) {
        ObjectNode root = om.createObjectNode();
        root.put("type", MessageType.ERROR.wire());
        root.put("message", message);
        if (code != null) root.put("code", code);
        return write(root);
    }

    public String notification(String title, String message, String level, Map<String, Object> data) {
        ObjectNode root = om.createObjectNode();
        root.put("type", MessageType.NOTIFICATION.wire());
        if (title != null) root.put("title", title);
        root.put("message", message);
        root.put("level", (level == null || level.isBlank()) ? "info" : level);
        if (data != null && !data.isEmpty()) root.set("data", om.valueToTree(data));
        return write(root);
    }

    public Object toPlain(JsonNode node) {
        return (node == null || node.isNull() || node.isMissingNode()) ? null : om.convertValue(node, Object.class);
    }

    private String write(ObjectNode root) {
        try {
            return om.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize relay message", e);
        }
    }

    private static GatewayException protocol(String message) {
        return new GatewayException(GatewayErrorKind.PROTOCOL_ERROR, message);
    }
}
