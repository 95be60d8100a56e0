package com.example.sessionrelay.request;

import com.example.sessionrelay.config.GatewayProperties;
import com.example.sessionrelay.model.BuiltRequest;
import com.example.sessionrelay.model.CredentialSnapshot;
import com.example.sessionrelay.model.LogicalRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a logical call to the exact outbound request. Both execution paths go through here, so the server path
 * and the browser path see the same URL, header names and header order; only the credential-derived header
 * values differ.
 */
@Component
public class RequestTemplateEngine {

    public static final String ACCEPT = "application/vnd.linkedin.normalized+json+2.1";
    public static final String RESTLI_PROTOCOL_VERSION = "2.0.0";

    // cookies that outlive a browsing session; analytics and edge cookies rotate within minutes
    private static final List<String> STABLE_COOKIES = List.of(CredentialSnapshot.LI_AT, CredentialSnapshot.JSESSIONID, "liap");

    private final String baseUrl;
    private final ObjectMapper om = new ObjectMapper();

    public RequestTemplateEngine(GatewayProperties properties) {
        String base = properties.getUpstreamBaseUrl();
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        this.baseUrl = base;
    }

    public BuiltRequest build(LogicalRequest request, CredentialSnapshot credentials) {
        return build(request.getEndpoint(), request.getParams(), credentials);
    }

    public BuiltRequest build(String endpointId, Map<String, Object> params, CredentialSnapshot credentials) {
        Endpoint endpoint = Endpoint.fromId(endpointId);
        RequestParams p = RequestParams.resolve(endpoint.id(), endpoint.params(), params);
        CredentialSnapshot creds = credentials == null ? CredentialSnapshot.empty() : credentials;

        String url = endpoint.url(baseUrl, p);
        String body = endpoint.body(p, om);
        return new BuiltRequest(endpoint.method(), url, headers(endpoint, creds, body != null), body);
    }

    private List<BuiltRequest.Header> headers(Endpoint endpoint, CredentialSnapshot creds, boolean hasBody) {
        List<BuiltRequest.Header> headers = new ArrayList<>(5);
        headers.add(new BuiltRequest.Header("accept", endpoint.accept()));
        if (creds.getCsrfToken() != null) {
            headers.add(new BuiltRequest.Header("csrf-token", unquote(creds.getCsrfToken())));
        }
        headers.add(new BuiltRequest.Header("x-restli-protocol-version", RESTLI_PROTOCOL_VERSION));
        if (hasBody) {
            headers.add(new BuiltRequest.Header("content-type", endpoint.contentType()));
        }
        String cookie = cookieHeader(creds.getCookies());
        if (cookie != null) {
            headers.add(new BuiltRequest.Header("cookie", cookie));
        }
        return headers;
    }

    static String cookieHeader(Map<String, String> cookies) {
        List<String> parts = new ArrayList<>(STABLE_COOKIES.size());
        for (String name : STABLE_COOKIES) {
            String value = cookies.get(name);
            if (value == null || value.isBlank()) continue;
            if (CredentialSnapshot.JSESSIONID.equals(name)) {
                parts.add(name + "=\"" + unquote(value) + "\"");
            } else {
                parts.add(name + "=" + value);
            }
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    static String unquote(String value) {
        String v = value.trim();
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }
}
