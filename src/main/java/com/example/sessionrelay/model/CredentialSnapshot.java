package com.example.sessionrelay.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial credential set held for a user. Read-only; may be missing the session cookies a direct call needs.
 */
public final class CredentialSnapshot {

    public static final String LI_AT = "li_at";
    public static final String JSESSIONID = "JSESSIONID";

    private static final CredentialSnapshot EMPTY = new CredentialSnapshot(null, Collections.emptyMap(), 0L);

    private final String csrfToken; // nullable
    private final Map<String, String> cookies;
    private final long capturedAtEpochMs;

    public CredentialSnapshot(String csrfToken, Map<String, String> cookies, long capturedAtEpochMs) {
        this.csrfToken = (csrfToken == null || csrfToken.isBlank()) ? null : csrfToken;
        this.cookies = cookies == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(cookies));
        this.capturedAtEpochMs = capturedAtEpochMs;
    }

    public static CredentialSnapshot empty() {
        return EMPTY;
    }

    public String getCsrfToken() { return csrfToken; }
    public Map<String, String> getCookies() { return cookies; }
    public long getCapturedAtEpochMs() { return capturedAtEpochMs; }

    public boolean hasCookie(String name) {
        String v = cookies.get(name);
        return v != null && !v.isBlank();
    }

    /**
     * True when a direct server-side call has everything the upstream insists on.
     */
    public boolean isCompleteForServerCall() {
        return csrfToken != null && hasCookie(LI_AT) && hasCookie(JSESSIONID);
    }

    /**
     * View used for delegated execution: the browser attaches its own cookie jar.
     */
    public CredentialSnapshot withoutCookies() {
        return new CredentialSnapshot(csrfToken, Collections.emptyMap(), capturedAtEpochMs);
    }
}
