package com.example.sessionrelay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical call against the upstream API: endpoint id, ordered parameters and the user it runs for.
 * Parameter order is preserved exactly as given.
 */
public final class LogicalRequest {
    private final String endpoint;
    private final Map<String, Object> params;
    private final String userId;

    public LogicalRequest(String endpoint, Map<String, Object> params, String userId) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.params = params == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.userId = userId;
    }

    public String getEndpoint() { return endpoint; }
    public Map<String, Object> getParams() { return params; }
    public String getUserId() { return userId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicalRequest)) return false;
        LogicalRequest that = (LogicalRequest) o;
        return endpoint.equals(that.endpoint) && params.equals(that.params) && Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpoint, params, userId);
    }

    @Override
    public String toString() {
        return "LogicalRequest{endpoint=" + endpoint + ", params=" + params + ", userId=" + userId + "}";
    }
}
