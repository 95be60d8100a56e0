package com.example.sessionrelay.ws;

import com.example.sessionrelay.model.BuiltRequest;
import com.example.sessionrelay.model.ExecutionPolicy;
import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.model.GatewayErrorKind;
import com.example.sessionrelay.model.LogicalRequest;
import com.example.sessionrelay.model.NotificationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for work that runs in the user's browser: delegated calls and fire-and-forget notifications.
 */
@Service
public class DelegationService {

    private static final Logger log = LoggerFactory.getLogger(DelegationService.class);

    private final ConnectionRegistry registry;
    private final RelayMessageCodec codec;

    public DelegationService(ConnectionRegistry registry, RelayMessageCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    /**
     * Forwards an HTTP call to the user's browser.
     */
    public CompletableFuture<ExecutionResult> delegate(LogicalRequest request, BuiltRequest http, Duration timeout) {
        Optional<RelayConnection> conn = registry.lookup(request.getUserId());
        if (conn.isEmpty()) {
            log.info("No delegate connection. userId={} endpoint={}", request.getUserId(), request.getEndpoint());
            return CompletableFuture.completedFuture(ExecutionResult.failure(ExecutionPolicy.DELEGATED,
                    GatewayErrorKind.NO_DELEGATE_AVAILABLE, "No live browser connection for user " + request.getUserId()));
        }
        return conn.get().dispatch(request, http, timeout);
    }

    /**
     * Forwards a command the browser handles itself (no HTTP envelope); the response payload is passed through.
     */
    public CompletableFuture<ExecutionResult> delegate(LogicalRequest request, Duration timeout) {
        return delegate(request, null, timeout);
    }

    /**
     * @return false when the user has no open connection or the send failed
     */
    public boolean notify(String userId, NotificationRequest notification) {
        Optional<RelayConnection> conn = registry.lookup(userId);
        if (conn.isEmpty()) return false;
        try {
            conn.get().send(codec.notification(notification.getTitle(), notification.getMessage(),
                    notification.getLevel(), notification.getData()));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Notification send failed. userId={} error={}", userId, e.toString());
            return false;
        }
    }
}
