package com.example.sessionrelay.ws;

import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.model.LogicalRequest;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * A delegated call waiting for its response. Whoever removes it from the {@link PendingCallTable} resolves it;
 * the result slot is completed exactly once.
 */
public final class PendingCall {
    private final String correlationId;
    private final LogicalRequest request;
    private final long deadlineEpochMs;
    private final boolean http;
    private final CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
    private volatile ScheduledFuture<?> expiry;

    PendingCall(String correlationId, LogicalRequest request, long deadlineEpochMs, boolean http) {
        this.correlationId = correlationId;
        this.request = request;
        this.deadlineEpochMs = deadlineEpochMs;
        this.http = http;
    }

    public String getCorrelationId() { return correlationId; }
    public LogicalRequest getRequest() { return request; }
    public long getDeadlineEpochMs() { return deadlineEpochMs; }

    /** True when the browser was asked to perform an HTTP call and answers with status/headers/body. */
    public boolean isHttp() { return http; }

    public CompletableFuture<ExecutionResult> result() { return result; }

    void setExpiry(ScheduledFuture<?> expiry) {
        this.expiry = expiry;
    }

    void resolve(ExecutionResult r) {
        ScheduledFuture<?> f = expiry;
        if (f != null) f.cancel(false);
        result.complete(r);
    }
}
