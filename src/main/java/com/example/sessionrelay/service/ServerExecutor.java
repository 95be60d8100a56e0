package com.example.sessionrelay.service;

import com.example.sessionrelay.model.BuiltRequest;
import com.example.sessionrelay.model.CredentialSnapshot;
import com.example.sessionrelay.model.ExecutionPolicy;
import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.model.GatewayErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sends a built request directly from the backend. No retries here; the caller owns retry policy.
 */
@Service
public class ServerExecutor {

    private static final Logger log = LoggerFactory.getLogger(ServerExecutor.class);

    private final HttpClient httpClient;

    public ServerExecutor(HttpClient upstreamHttpClient) {
        this.httpClient = upstreamHttpClient;
    }

    public ExecutionResult execute(BuiltRequest request, CredentialSnapshot credentials, Duration timeout) {
        if (credentials == null || !credentials.isCompleteForServerCall()) {
            log.warn("Server call refused, credential snapshot incomplete. url={}", request.getUrl());
            return ExecutionResult.failure(ExecutionPolicy.SERVER, GatewayErrorKind.INCOMPLETE_CREDENTIALS,
                    "Stored credentials lack csrf token, li_at or JSESSIONID; retry with delegated execution");
        }
        return execute(request, timeout);
    }

    /**
     * Sends the request exactly as built.
     */
    public ExecutionResult execute(BuiltRequest request, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(request.getUrl()))
                .timeout(timeout)
                .method(request.getMethod(), request.getBody() == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(request.getBody()));
        for (BuiltRequest.Header h : request.getHeaders()) {
            builder.header(h.getName(), h.getValue());
        }

        long started = System.currentTimeMillis();
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            log.info("Server call done. method={} url={} status={} durationMs={}",
                    request.getMethod(), abbreviate(request.getUrl()), response.statusCode(), System.currentTimeMillis() - started);
            return StatusClassifier.classify(ExecutionPolicy.SERVER, response.statusCode(),
                    flatten(response.headers()), response.body());
        } catch (HttpTimeoutException e) {
            log.warn("Server call timed out after {}ms. url={}", timeout.toMillis(), abbreviate(request.getUrl()));
            return ExecutionResult.failure(ExecutionPolicy.SERVER, GatewayErrorKind.TIMEOUT,
                    "Upstream did not respond within " + timeout.toMillis() + "ms");
        } catch (IOException e) {
            log.warn("Server call failed. url={} error={}", abbreviate(request.getUrl()), e.toString());
            return ExecutionResult.failure(ExecutionPolicy.SERVER, GatewayErrorKind.UPSTREAM_ERROR,
                    "Transport failure: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure(ExecutionPolicy.SERVER, GatewayErrorKind.UPSTREAM_ERROR,
                    "Interrupted while waiting for upstream");
        }
    }

    static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> out = new TreeMap<>();
        for (Map.Entry<String, List<String>> e : headers.map().entrySet()) {
            if (e.getKey() == null || e.getKey().startsWith(":") || e.getValue().isEmpty()) continue;
            out.put(e.getKey().toLowerCase(), e.getValue().get(0));
        }
        return out;
    }

    static String abbreviate(String url) {
        return url.length() > 120 ? url.substring(0, 120) + "..." : url;
    }
}
