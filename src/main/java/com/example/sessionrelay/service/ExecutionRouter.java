package com.example.sessionrelay.service;

import com.example.sessionrelay.config.GatewayProperties;
import com.example.sessionrelay.exception.GatewayException;
import com.example.sessionrelay.model.BuiltRequest;
import com.example.sessionrelay.model.CredentialSnapshot;
import com.example.sessionrelay.model.ExecutionPolicy;
import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.model.GatewayErrorKind;
import com.example.sessionrelay.model.LogicalRequest;
import com.example.sessionrelay.request.RequestTemplateEngine;
import com.example.sessionrelay.ws.DelegationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Single entry point for callers. Builds the request once and runs it on exactly one path, chosen by an explicit
 * policy; a failure on one path is never retried on the other.
 */
@Service
public class ExecutionRouter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRouter.class);

    enum CallState { RECEIVED, ROUTE_SERVER, ROUTE_DELEGATED, SUCCEEDED, FAILED }

    private final RequestTemplateEngine templates;
    private final CredentialStore credentials;
    private final ServerExecutor serverExecutor;
    private final DelegationService delegation;
    private final GatewayProperties properties;

    public ExecutionRouter(RequestTemplateEngine templates,
                           CredentialStore credentials,
                           ServerExecutor serverExecutor,
                           DelegationService delegation,
                           GatewayProperties properties) {
        this.templates = templates;
        this.credentials = credentials;
        this.serverExecutor = serverExecutor;
        this.delegation = delegation;
        this.properties = properties;
    }

    /**
     * Per-call flag, else the user's configured policy, else the gateway default.
     */
    public ExecutionPolicy resolvePolicy(String userId, ExecutionPolicy requested) {
        if (requested != null) return requested;
        ExecutionPolicy perUser = properties.getUserPolicies().get(userId);
        return perUser != null ? perUser : properties.getDefaultPolicy();
    }

    /**
     * Blocks until the call resolves; bounded by the effective timeout.
     */
    public ExecutionResult execute(String userId, String endpoint, Map<String, Object> params,
                                   ExecutionPolicy policy, Duration timeout) {
        return executeAsync(userId, endpoint, params, policy, timeout).join();
    }

    public CompletableFuture<ExecutionResult> executeAsync(String userId, String endpoint, Map<String, Object> params,
                                                           ExecutionPolicy policy, Duration timeout) {
        ExecutionPolicy p = resolvePolicy(userId, policy);
        Duration t = properties.effectiveTimeout(timeout);
        transition(CallState.RECEIVED, userId, endpoint, p, null);

        LogicalRequest request;
        BuiltRequest built;
        CredentialSnapshot snapshot = credentials.snapshot(userId);
        try {
            request = new LogicalRequest(endpoint, params, userId);
            // the browser attaches its own cookies, so the delegated path never sees them
            built = templates.build(request, p == ExecutionPolicy.SERVER ? snapshot : snapshot.withoutCookies());
        } catch (GatewayException e) {
            return CompletableFuture.completedFuture(finish(userId, endpoint,
                    ExecutionResult.failure(p, e.getKind(), e.getMessage())));
        }

        if (p == ExecutionPolicy.SERVER) {
            transition(CallState.ROUTE_SERVER, userId, endpoint, p, null);
            return CompletableFuture.completedFuture(finish(userId, endpoint,
                    serverExecutor.execute(built, snapshot, t)));
        }

        transition(CallState.ROUTE_DELEGATED, userId, endpoint, p, null);
        return delegation.delegate(request, built, t)
                .handle((result, ex) -> {
                    if (ex != null) {
                        log.error("Delegated call failed unexpectedly. userId={} endpoint={}", userId, endpoint, ex);
                        return finish(userId, endpoint, ExecutionResult.failure(ExecutionPolicy.DELEGATED,
                                GatewayErrorKind.DISCONNECTED, String.valueOf(ex.getMessage())));
                    }
                    return finish(userId, endpoint, result);
                });
    }

    private ExecutionResult finish(String userId, String endpoint, ExecutionResult result) {
        transition(result.isSuccess() ? CallState.SUCCEEDED : CallState.FAILED,
                userId, endpoint, result.getPolicy(), result);
        return result;
    }

    private static void transition(CallState state, String userId, String endpoint, ExecutionPolicy policy,
                                   ExecutionResult result) {
        if (state == CallState.FAILED) {
            log.warn("CALL {} userId={} endpoint={} policy={} kind={} message={}",
                    state, userId, endpoint, policy, result.getErrorKind(), result.getErrorMessage());
        } else if (state == CallState.SUCCEEDED) {
            log.info("CALL {} userId={} endpoint={} policy={} status={}",
                    state, userId, endpoint, policy, result.getStatusCode());
        } else {
            log.debug("CALL {} userId={} endpoint={} policy={}", state, userId, endpoint, policy);
        }
    }
}
