package com.example.sessionrelay.ws;

import com.example.sessionrelay.model.BuiltRequest;
import com.example.sessionrelay.model.ExecutionPolicy;
import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.model.GatewayErrorKind;
import com.example.sessionrelay.model.LogicalRequest;
import com.example.sessionrelay.service.StatusClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One authenticated browser connection and the delegated calls multiplexed over it.
 * Callers wait on their own future; nothing here blocks the transport's read side.
 */
public class RelayConnection {

    private static final Logger log = LoggerFactory.getLogger(RelayConnection.class);

    static final int CLOSE_UNRESPONSIVE = 4000;
    static final int CODE_PROTOCOL = 4002;
    static final int CLOSE_SUPERSEDED = 4003;

    private final String userId;
    private final DelegateTransport transport;
    private final RelayMessageCodec codec;
    private final ScheduledExecutorService scheduler;
    private final PendingCallTable pending;
    private final Consumer<RelayConnection> onDropped;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final long openedAtEpochMs;
    private volatile long lastSeenEpochMs;

    public RelayConnection(String userId, DelegateTransport transport, RelayMessageCodec codec,
                           ScheduledExecutorService scheduler, Consumer<RelayConnection> onDropped) {
        this.userId = userId;
        this.transport = transport;
        this.codec = codec;
        this.scheduler = scheduler;
        this.pending = new PendingCallTable(transport.id());
        this.onDropped = onDropped;
        this.openedAtEpochMs = System.currentTimeMillis();
        this.lastSeenEpochMs = openedAtEpochMs;
    }

    public String getId() { return transport.id(); }
    public String getUserId() { return userId; }
    public DelegateTransport getTransport() { return transport; }
    public ConnectionState getState() { return state.get(); }
    public int pendingCount() { return pending.size(); }
    public long getOpenedAtEpochMs() { return openedAtEpochMs; }
    public long getLastSeenEpochMs() { return lastSeenEpochMs; }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    void open() {
        if (state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
            touch();
        }
    }

    public void touch() {
        lastSeenEpochMs = System.currentTimeMillis();
    }

    /**
     * Sends a {@code request} message and returns the caller's result slot.
     *
     * @param http the built request for HTTP endpoints (the cookie header is stripped before sending),
     *             or null for commands the browser handles itself
     */
    public CompletableFuture<ExecutionResult> dispatch(LogicalRequest request, BuiltRequest http, Duration timeout) {
        if (!isOpen()) {
            return CompletableFuture.completedFuture(disconnected("Connection is " + state.get()));
        }

        long deadline = System.currentTimeMillis() + timeout.toMillis();
        PendingCall call = pending.open(request, deadline, http != null);
        if (call == null) {
            return CompletableFuture.completedFuture(disconnected("Connection closed"));
        }

        String id = call.getCorrelationId();
        try {
            call.setExpiry(scheduler.schedule(() -> expire(id), timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            PendingCall taken = pending.take(id);
            if (taken != null) taken.resolve(disconnected("Gateway shutting down"));
            return call.result();
        }

        try {
            transport.send(codec.request(id, request, http == null ? null : http.withoutHeader("cookie")));
            log.debug("Delegated request sent. userId={} requestId={} endpoint={}", userId, id, request.getEndpoint());
        } catch (IOException | RuntimeException e) {
            log.warn("Delegated request send failed. userId={} requestId={} error={}", userId, id, e.toString());
            PendingCall taken = pending.take(id);
            if (taken != null) taken.resolve(disconnected("Send failed: " + e.getMessage()));
            drop(CLOSE_UNRESPONSIVE, "send failed");
        }
        return call.result();
    }

    /**
     * Routes a {@code response} to its waiting caller. Responses for unknown or already expired ids are dropped.
     *
     * @return whether a caller was resolved
     */
    public boolean onResponse(InboundMessage msg) {
        touch();
        PendingCall call = pending.take(msg.getRequestId());
        if (call == null) {
            log.info("Discarding response with no pending call (late or unknown). userId={} requestId={}",
                    userId, msg.getRequestId());
            return false;
        }
        ExecutionResult result = toResult(call, msg);
        call.resolve(result);
        log.debug("Delegated call resolved. userId={} requestId={} result={}", userId, call.getCorrelationId(), result);
        if (result.getErrorKind() == GatewayErrorKind.PROTOCOL_ERROR) {
            protocolError(result.getErrorMessage());
        }
        return true;
    }

    private void expire(String correlationId) {
        PendingCall call = pending.take(correlationId);
        if (call == null) return;
        log.warn("Delegated call timed out. userId={} requestId={} endpoint={} deadline={}",
                userId, correlationId, call.getRequest().getEndpoint(), call.getDeadlineEpochMs());
        call.resolve(ExecutionResult.failure(ExecutionPolicy.DELEGATED, GatewayErrorKind.TIMEOUT,
                "Browser did not respond before the deadline; the call may still complete there"));
    }

    private ExecutionResult toResult(PendingCall call, InboundMessage msg) {
        JsonNode root = msg.getRoot();
        if (!codec.isSuccess(msg)) {
            String error = msg.text("error");
            if (error == null) error = msg.text("error_message");
            return ExecutionResult.failure(ExecutionPolicy.DELEGATED, GatewayErrorKind.DELEGATE_ERROR,
                    error == null ? "Browser reported failure" : error);
        }

        JsonNode payload = root.has("payload") ? root.get("payload") : root.get("data");
        if (!call.isHttp()) {
            return ExecutionResult.payload(ExecutionPolicy.DELEGATED, codec.toPlain(payload));
        }

        if (payload == null || !payload.isObject()) {
            return protocolFailure("response payload missing");
        }
        JsonNode status = payload.get("status_code");
        if (status == null || !status.canConvertToInt()) {
            return protocolFailure("response payload without status_code");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        JsonNode h = payload.get("headers");
        if (h != null && h.isObject()) {
            h.fields().forEachRemaining(e -> headers.put(e.getKey().toLowerCase(), e.getValue().asText()));
        }
        JsonNode body = payload.get("body");
        String bodyText = (body == null || body.isNull()) ? null : (body.isTextual() ? body.asText() : body.toString());
        return StatusClassifier.classify(ExecutionPolicy.DELEGATED, status.asInt(), headers, bodyText);
    }

    private static ExecutionResult protocolFailure(String message) {
        return ExecutionResult.failure(ExecutionPolicy.DELEGATED, GatewayErrorKind.PROTOCOL_ERROR, message);
    }

    private static ExecutionResult disconnected(String message) {
        return ExecutionResult.failure(ExecutionPolicy.DELEGATED, GatewayErrorKind.DISCONNECTED, message);
    }

    public void send(String text) throws IOException {
        transport.send(text);
    }

    /**
     * Moves to a terminal state and fails every outstanding call with {@code DISCONNECTED}.
     *
     * @return false if the connection was already terminal
     */
    public boolean terminate(ConnectionState finalState, String reason) {
        while (true) {
            ConnectionState current = state.get();
            if (current.isTerminal()) return false;
            if (state.compareAndSet(current, finalState)) break;
        }
        List<PendingCall> drained = pending.closeAndDrain();
        for (PendingCall call : drained) {
            call.resolve(disconnected("Connection lost before response (" + reason + ")"));
        }
        log.info("Relay connection {}. userId={} connectionId={} reason={} failedCalls={}",
                finalState, userId, getId(), reason, drained.size());
        return true;
    }

    /**
     * Fails outstanding calls, leaves the registry and closes the transport.
     */
    public void drop(int closeCode, String reason) {
        onDropped.accept(this);
        terminate(ConnectionState.DISCONNECTED, reason);
        transport.close(closeCode, reason);
    }

    /**
     * Tells the browser why, then drops the connection with a protocol-error close.
     */
    public void protocolError(String reason) {
        log.warn("Protocol error, closing connection. userId={} connectionId={} reason={}", userId, getId(), reason);
        try {
            transport.send(codec.error(reason, CODE_PROTOCOL));
        } catch (IOException | RuntimeException e) {
            log.debug("Protocol error notice not delivered. connectionId={} error={}", getId(), e.toString());
        }
        drop(CloseStatus.PROTOCOL_ERROR.getCode(), "protocol error");
    }

    /**
     * A newer connection for the same user took over: CLOSING, fail pending, close transport, CLOSED.
     */
    void supersede() {
        if (!state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSING)
                && !state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CLOSING)) {
            return;
        }
        terminate(ConnectionState.CLOSED, "superseded");
        transport.close(CLOSE_SUPERSEDED, "Superseded by a newer connection");
    }
}
