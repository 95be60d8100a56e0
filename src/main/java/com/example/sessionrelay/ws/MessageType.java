package com.example.sessionrelay.ws;

import java.util.Optional;

/**
 * Message types on the relay connection. Direction matters: the browser may only send
 * {@code auth}, {@code ping}, {@code pong}, {@code response} and {@code error}.
 */
public enum MessageType {
    AUTH("auth", true),
    AUTH_SUCCESS("auth_success", false),
    PING("ping", true),
    PONG("pong", true),
    REQUEST("request", false),
    RESPONSE("response", true),
    NOTIFICATION("notification", false),
    ERROR("error", true);

    private final String wire;
    private final boolean fromClient;

    MessageType(String wire, boolean fromClient) {
        this.wire = wire;
        this.fromClient = fromClient;
    }

    public String wire() { return wire; }
    public boolean isFromClient() { return fromClient; }

    public static Optional<MessageType> fromWire(String s) {
        for (MessageType t : values()) {
            if (t.wire.equals(s)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
