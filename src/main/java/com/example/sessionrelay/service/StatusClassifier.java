package com.example.sessionrelay.service;

import com.example.sessionrelay.model.ExecutionPolicy;
import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.model.GatewayErrorKind;

import java.util.Map;

/**
 * Upstream HTTP status to result. Shared by both paths so a 429 means the same thing whoever sent the request.
 */
public final class StatusClassifier {

    private StatusClassifier() {}

    public static ExecutionResult classify(ExecutionPolicy policy, int status, Map<String, String> headers, String body) {
        if (status >= 200 && status < 300) {
            return ExecutionResult.http(policy, status, headers, body);
        }
        GatewayErrorKind kind = kindFor(status);
        Long retryAfter = kind == GatewayErrorKind.RATE_LIMITED ? retryAfterSeconds(headers) : null;
        return ExecutionResult.upstreamFailure(policy, kind, status, headers, body, retryAfter);
    }

    static GatewayErrorKind kindFor(int status) {
        if (status == 401 || status == 403) return GatewayErrorKind.AUTH_REJECTED;
        if (status == 429) return GatewayErrorKind.RATE_LIMITED;
        if (status >= 400 && status < 500) return GatewayErrorKind.CLIENT_ERROR;
        return GatewayErrorKind.UPSTREAM_ERROR;
    }

    /**
     * Delta-seconds form only; HTTP-date values are ignored.
     */
    static Long retryAfterSeconds(Map<String, String> headers) {
        if (headers == null) return null;
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (!"retry-after".equalsIgnoreCase(e.getKey()) || e.getValue() == null) continue;
            try {
                long v = Long.parseLong(e.getValue().trim());
                return v >= 0 ? v : null;
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
