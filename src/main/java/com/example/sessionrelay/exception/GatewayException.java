package com.example.sessionrelay.exception;

import com.example.sessionrelay.model.GatewayErrorKind;

/**
 * Typed failure raised inside the gateway; converted to an {@code ExecutionResult} at the router boundary.
 */
public class GatewayException extends RuntimeException {
    private final GatewayErrorKind kind;

    public GatewayException(GatewayErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GatewayException(GatewayErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public GatewayErrorKind getKind() {
        return kind;
    }
}
