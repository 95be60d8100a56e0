package com.example.sessionrelay.persistence;

import javax.persistence.*;

/**
 * Session token issued by the login flow; the browser presents it in its first WebSocket message.
 */
@Entity
@Table(name = "sr_user_session", indexes = @Index(name = "ix_sr_user_session_user", columnList = "userId"))
public class UserSessionEntity {

    @Id
    @Column(length = 128)
    private String sessionToken;

    @Column(length = 64, nullable = false)
    private String userId;

    private long expiresAtEpochMs;

    private long lastActivityEpochMs;

    protected UserSessionEntity() {}

    public UserSessionEntity(String sessionToken, String userId, long expiresAtEpochMs) {
        this.sessionToken = sessionToken;
        this.userId = userId;
        this.expiresAtEpochMs = expiresAtEpochMs;
    }

    public String getSessionToken() { return sessionToken; }
    public String getUserId() { return userId; }
    public long getExpiresAtEpochMs() { return expiresAtEpochMs; }
    public long getLastActivityEpochMs() { return lastActivityEpochMs; }

    public void touch(long nowEpochMs) {
        this.lastActivityEpochMs = nowEpochMs;
    }
}
