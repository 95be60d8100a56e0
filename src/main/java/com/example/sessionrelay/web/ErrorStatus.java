package com.example.sessionrelay.web;

import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.model.GatewayErrorKind;
import org.springframework.http.HttpStatus;

public final class ErrorStatus {

    private ErrorStatus() {}

    public static HttpStatus of(GatewayErrorKind kind) {
        switch (kind) {
            case UNSUPPORTED_ENDPOINT:
            case INVALID_PARAMETERS:
            case CLIENT_ERROR:
                return HttpStatus.BAD_REQUEST;
            case INCOMPLETE_CREDENTIALS:
                return HttpStatus.CONFLICT;
            case AUTH_REJECTED:
                return HttpStatus.UNAUTHORIZED;
            case RATE_LIMITED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case NO_DELEGATE_AVAILABLE:
            case DISCONNECTED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case UPSTREAM_ERROR:
            case DELEGATE_ERROR:
            case PROTOCOL_ERROR:
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }

    public static HttpStatus of(ExecutionResult result) {
        return result.isSuccess() ? HttpStatus.OK : of(result.getErrorKind());
    }
}
