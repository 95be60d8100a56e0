package com.example.sessionrelay.service;

import com.example.sessionrelay.config.GatewayProperties;
import com.example.sessionrelay.persistence.UserSessionEntity;
import com.example.sessionrelay.persistence.UserSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Issues relay session tokens and resolves the token a browser presents in its {@code auth} message to a user id.
 */
@Service
public class SessionAuthService {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthService.class);

    static final String TOKEN_PREFIX = "LOCAL_SESSION_";

    private final UserSessionRepository repository;
    private final GatewayProperties properties;

    public SessionAuthService(UserSessionRepository repository, GatewayProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Transactional
    public UserSessionEntity issue(String userId) {
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
        long now = System.currentTimeMillis();
        UserSessionEntity session = new UserSessionEntity(TOKEN_PREFIX + UUID.randomUUID(), userId,
                now + properties.getSessionTtl().toMillis());
        session.touch(now);
        repository.save(session);
        log.info("Relay session issued. userId={} expiresAt={}", userId, session.getExpiresAtEpochMs());
        return session;
    }

    @Transactional
    public Optional<String> authenticate(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        long now = System.currentTimeMillis();
        Optional<UserSessionEntity> session = repository.findValid(token, now);
        if (session.isEmpty()) {
            log.info("Relay auth rejected: no valid session for token");
            return Optional.empty();
        }
        UserSessionEntity s = session.get();
        s.touch(now);
        repository.save(s);
        return Optional.of(s.getUserId());
    }
}
