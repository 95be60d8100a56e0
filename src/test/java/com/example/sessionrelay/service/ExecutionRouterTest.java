package com.example.sessionrelay.service;

import com.example.sessionrelay.config.GatewayProperties;
import com.example.sessionrelay.model.BuiltRequest;
import com.example.sessionrelay.model.CredentialSnapshot;
import com.example.sessionrelay.model.ExecutionPolicy;
import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.model.GatewayErrorKind;
import com.example.sessionrelay.model.LogicalRequest;
import com.example.sessionrelay.request.RequestTemplateEngine;
import com.example.sessionrelay.ws.DelegationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExecutionRouterTest {

    private GatewayProperties props;
    private CredentialStore store;
    private ServerExecutor serverExecutor;
    private DelegationService delegation;
    private ExecutionRouter router;
    private CredentialSnapshot full;

    @BeforeEach
    void setUp() {
        props = new GatewayProperties();
        store = mock(CredentialStore.class);
        serverExecutor = mock(ServerExecutor.class);
        delegation = mock(DelegationService.class);
        router = new ExecutionRouter(new RequestTemplateEngine(props), store, serverExecutor, delegation, props);
        full = new CredentialSnapshot("ajax:1", Map.of("li_at", "A", "JSESSIONID", "ajax:1"), 1L);
        when(store.snapshot("u1")).thenReturn(full);
    }

    private static CompletableFuture<ExecutionResult> done(ExecutionResult r) {
        return CompletableFuture.completedFuture(r);
    }

    @Test
    void defaultPolicyDelegatesWithoutCookies() {
        when(delegation.delegate(any(LogicalRequest.class), any(BuiltRequest.class), any(Duration.class)))
                .thenReturn(done(ExecutionResult.http(ExecutionPolicy.DELEGATED, 200, Map.of(), "{}")));

        ExecutionResult r = router.execute("u1", "feed", Map.of("count", 3), null, null);

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getPolicy()).isEqualTo(ExecutionPolicy.DELEGATED);
        ArgumentCaptor<BuiltRequest> built = ArgumentCaptor.forClass(BuiltRequest.class);
        ArgumentCaptor<LogicalRequest> logical = ArgumentCaptor.forClass(LogicalRequest.class);
        verify(delegation).delegate(logical.capture(), built.capture(), eq(Duration.ofSeconds(60)));
        assertThat(built.getValue().header("cookie")).isNull();
        assertThat(built.getValue().header("csrf-token")).isEqualTo("ajax:1");
        assertThat(logical.getValue()).isEqualTo(new LogicalRequest("feed", Map.of("count", 3), "u1"));
        verifyNoInteractions(serverExecutor);
    }

    @Test
    void serverPolicySendsFullCredentials() {
        when(serverExecutor.execute(any(BuiltRequest.class), any(CredentialSnapshot.class), any(Duration.class)))
                .thenReturn(ExecutionResult.http(ExecutionPolicy.SERVER, 200, Map.of(), "{}"));

        ExecutionResult r = router.execute("u1", "profile_identity", Map.of("profileId", "ACo"), ExecutionPolicy.SERVER,
                Duration.ofSeconds(5));

        assertThat(r.getPolicy()).isEqualTo(ExecutionPolicy.SERVER);
        ArgumentCaptor<BuiltRequest> built = ArgumentCaptor.forClass(BuiltRequest.class);
        verify(serverExecutor).execute(built.capture(), eq(full), eq(Duration.ofSeconds(5)));
        assertThat(built.getValue().header("cookie")).isEqualTo("li_at=A; JSESSIONID=\"ajax:1\"");
        verifyNoInteractions(delegation);
    }

    @Test
    void serverPolicyWithIncompleteSnapshotTouchesNoNetwork() {
        HttpClient http = mock(HttpClient.class);
        ExecutionRouter withRealExecutor = new ExecutionRouter(new RequestTemplateEngine(props), store,
                new ServerExecutor(http), delegation, props);
        when(store.snapshot("u3")).thenReturn(new CredentialSnapshot("ajax:1", Map.of(), 1L));

        ExecutionResult r = withRealExecutor.execute("u3", "feed", Map.of(), ExecutionPolicy.SERVER, null);

        assertThat(r.getErrorKind()).isEqualTo(GatewayErrorKind.INCOMPLETE_CREDENTIALS);
        verifyNoInteractions(http, delegation);
    }

    @Test
    void delegatedFailureIsNotRetriedOnServer() {
        when(delegation.delegate(any(LogicalRequest.class), any(BuiltRequest.class), any(Duration.class)))
                .thenReturn(done(ExecutionResult.failure(ExecutionPolicy.DELEGATED, GatewayErrorKind.NO_DELEGATE_AVAILABLE, "none")));

        ExecutionResult r = router.execute("u1", "feed", Map.of(), ExecutionPolicy.DELEGATED, null);

        assertThat(r.getErrorKind()).isEqualTo(GatewayErrorKind.NO_DELEGATE_AVAILABLE);
        verifyNoInteractions(serverExecutor);
    }

    @Test
    void badRequestsFailBeforeAnyPath() {
        ExecutionResult unknown = router.execute("u1", "inbox", Map.of(), null, null);
        ExecutionResult invalid = router.execute("u1", "comments", Map.of("postUrl", "nope"), ExecutionPolicy.SERVER, null);

        assertThat(unknown.getErrorKind()).isEqualTo(GatewayErrorKind.UNSUPPORTED_ENDPOINT);
        assertThat(unknown.getPolicy()).isEqualTo(ExecutionPolicy.DELEGATED);
        assertThat(invalid.getErrorKind()).isEqualTo(GatewayErrorKind.INVALID_PARAMETERS);
        verifyNoInteractions(serverExecutor, delegation);
    }

    @Test
    void policyResolution() {
        props.getUserPolicies().put("u9", ExecutionPolicy.SERVER);

        assertThat(router.resolvePolicy("u9", null)).isEqualTo(ExecutionPolicy.SERVER);
        assertThat(router.resolvePolicy("u9", ExecutionPolicy.DELEGATED)).isEqualTo(ExecutionPolicy.DELEGATED);
        assertThat(router.resolvePolicy("u1", null)).isEqualTo(ExecutionPolicy.DELEGATED);

        props.setDefaultPolicy(ExecutionPolicy.SERVER);
        assertThat(router.resolvePolicy("u1", null)).isEqualTo(ExecutionPolicy.SERVER);
    }

    @Test
    void timeoutIsClampedToMaximum() {
        when(delegation.delegate(any(LogicalRequest.class), any(BuiltRequest.class), any(Duration.class)))
                .thenReturn(done(ExecutionResult.http(ExecutionPolicy.DELEGATED, 200, Map.of(), "")));

        router.execute("u1", "feed", Map.of(), null, Duration.ofHours(1));

        verify(delegation).delegate(any(LogicalRequest.class), any(BuiltRequest.class), eq(Duration.ofMinutes(5)));
    }
}
