package com.example.sessionrelay.exception;

import com.example.sessionrelay.model.GatewayErrorKind;

public class UnsupportedEndpointException extends GatewayException {
    public UnsupportedEndpointException(String endpoint) {
        super(GatewayErrorKind.UNSUPPORTED_ENDPOINT, "Unsupported endpoint: " + endpoint);
    }
}
