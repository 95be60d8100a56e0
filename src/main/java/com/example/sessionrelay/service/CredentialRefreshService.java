package com.example.sessionrelay.service;

import com.example.sessionrelay.config.GatewayProperties;
import com.example.sessionrelay.model.ExecutionPolicy;
import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.model.GatewayErrorKind;
import com.example.sessionrelay.model.LogicalRequest;
import com.example.sessionrelay.ws.DelegationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Asks the user's browser for its current csrf token and cookies and stores them.
 */
@Service
public class CredentialRefreshService {

    private static final Logger log = LoggerFactory.getLogger(CredentialRefreshService.class);

    public static final String COMMAND = "refresh_session";

    private final DelegationService delegation;
    private final CredentialStore credentials;
    private final GatewayProperties properties;

    public CredentialRefreshService(DelegationService delegation, CredentialStore credentials,
                                    GatewayProperties properties) {
        this.delegation = delegation;
        this.credentials = credentials;
        this.properties = properties;
    }

    public ExecutionResult refresh(String userId, Duration timeout) {
        LogicalRequest command = new LogicalRequest(COMMAND, Collections.emptyMap(), userId);
        ExecutionResult result = delegation.delegate(command, properties.effectiveTimeout(timeout)).join();
        if (!result.isSuccess()) {
            log.warn("Session refresh failed. userId={} kind={} message={}",
                    userId, result.getErrorKind(), result.getErrorMessage());
            return result;
        }
        if (!(result.getPayload() instanceof Map)) {
            return ExecutionResult.failure(ExecutionPolicy.DELEGATED, GatewayErrorKind.PROTOCOL_ERROR,
                    "refresh_session payload is not an object");
        }

        Map<?, ?> payload = (Map<?, ?>) result.getPayload();
        Object csrf = payload.get("csrf_token");
        Map<String, String> cookies = new LinkedHashMap<>();
        if (payload.get("cookies") instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) payload.get("cookies")).entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    cookies.put(e.getKey().toString(), e.getValue().toString());
                }
            }
        }
        credentials.save(userId, csrf == null ? null : csrf.toString(), cookies);
        log.info("Session refreshed. userId={} cookieNames={} csrf={}", userId, cookies.keySet(), csrf != null);
        return result;
    }
}
