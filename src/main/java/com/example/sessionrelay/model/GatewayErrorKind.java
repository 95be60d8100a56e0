package com.example.sessionrelay.model;

public enum GatewayErrorKind {
    UNSUPPORTED_ENDPOINT,
    INVALID_PARAMETERS,
    INCOMPLETE_CREDENTIALS,
    AUTH_REJECTED,
    RATE_LIMITED,
    UPSTREAM_ERROR,
    CLIENT_ERROR,
    NO_DELEGATE_AVAILABLE,
    TIMEOUT,
    DISCONNECTED,
    DELEGATE_ERROR,
    PROTOCOL_ERROR
}
