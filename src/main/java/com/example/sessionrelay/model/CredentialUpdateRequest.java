package com.example.sessionrelay.model;

import java.util.Map;

public class CredentialUpdateRequest {
    private String csrfToken;
    private Map<String, String> cookies;

    public CredentialUpdateRequest() {}

    public String getCsrfToken() { return csrfToken; }
    public void setCsrfToken(String csrfToken) { this.csrfToken = csrfToken; }

    public Map<String, String> getCookies() { return cookies; }
    public void setCookies(Map<String, String> cookies) { this.cookies = cookies; }
}
