package com.example.sessionrelay.exception;

import com.example.sessionrelay.model.GatewayErrorKind;

public class InvalidParametersException extends GatewayException {
    public InvalidParametersException(String message) {
        super(GatewayErrorKind.INVALID_PARAMETERS, message);
    }
}
