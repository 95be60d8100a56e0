package com.example.sessionrelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized outcome of a call, whichever path executed it.
 * Either success (status/headers/body or a non-HTTP payload) or a typed failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionResult {
    private final boolean success;
    private final ExecutionPolicy policy;
    private final int statusCode; // 0 when no upstream status exists
    private final Map<String, String> headers;
    private final String body;
    private final Object payload; // non-HTTP delegated payloads, e.g. refreshed credentials
    private final GatewayErrorKind errorKind;
    private final String errorMessage;
    private final Long retryAfterSeconds;

    private ExecutionResult(boolean success, ExecutionPolicy policy, int statusCode, Map<String, String> headers,
                            String body, Object payload, GatewayErrorKind errorKind, String errorMessage,
                            Long retryAfterSeconds) {
        this.success = success;
        this.policy = policy;
        this.statusCode = statusCode;
        this.headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
        this.payload = payload;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static ExecutionResult http(ExecutionPolicy policy, int statusCode, Map<String, String> headers, String body) {
        return new ExecutionResult(true, policy, statusCode, headers, body, null, null, null, null);
    }

    public static ExecutionResult payload(ExecutionPolicy policy, Object payload) {
        return new ExecutionResult(true, policy, 0, null, null, payload, null, null, null);
    }

    public static ExecutionResult failure(ExecutionPolicy policy, GatewayErrorKind kind, String message) {
        return new ExecutionResult(false, policy, 0, null, null, null, kind, message, null);
    }

    /**
     * Failure that carries the upstream response it was classified from.
     */
    public static ExecutionResult upstreamFailure(ExecutionPolicy policy, GatewayErrorKind kind, int statusCode,
                                                  Map<String, String> headers, String body, Long retryAfterSeconds) {
        return new ExecutionResult(false, policy, statusCode, headers, body, null, kind,
                "upstream responded " + statusCode, retryAfterSeconds);
    }

    public boolean isSuccess() { return success; }
    public ExecutionPolicy getPolicy() { return policy; }
    public int getStatusCode() { return statusCode; }
    public Map<String, String> getHeaders() { return headers; }
    public String getBody() { return body; }
    public Object getPayload() { return payload; }
    public GatewayErrorKind getErrorKind() { return errorKind; }
    public String getErrorMessage() { return errorMessage; }
    public Long getRetryAfterSeconds() { return retryAfterSeconds; }

    @Override
    public String toString() {
        if (success) return "ExecutionResult{success, policy=" + policy + ", status=" + statusCode + "}";
        return "ExecutionResult{failure=" + errorKind + ", policy=" + policy + ", message=" + errorMessage + "}";
    }
}
