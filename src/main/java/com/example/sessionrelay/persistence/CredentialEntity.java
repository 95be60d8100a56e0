package com.example.sessionrelay.persistence;

import javax.persistence.*;

@Entity
@Table(name = "sr_credential")
public class CredentialEntity {

    @Id
    @Column(length = 64)
    private String userId;

    @Column(length = 512)
    private String csrfToken;

    @Lob
    private String cookiesJson;

    private long capturedAtEpochMs;

    protected CredentialEntity() {}

    public CredentialEntity(String userId, String csrfToken, String cookiesJson, long capturedAtEpochMs) {
        this.userId = userId;
        this.csrfToken = csrfToken;
        this.cookiesJson = cookiesJson;
        this.capturedAtEpochMs = capturedAtEpochMs;
    }

    public String getUserId() { return userId; }
    public String getCsrfToken() { return csrfToken; }
    public String getCookiesJson() { return cookiesJson; }
    public long getCapturedAtEpochMs() { return capturedAtEpochMs; }

    public void update(String csrfToken, String cookiesJson, long capturedAtEpochMs) {
        this.csrfToken = csrfToken;
        this.cookiesJson = cookiesJson;
        this.capturedAtEpochMs = capturedAtEpochMs;
    }
}
