package com.example.sessionrelay.service;

import com.example.sessionrelay.model.CredentialSnapshot;
import com.example.sessionrelay.persistence.CredentialEntity;
import com.example.sessionrelay.persistence.CredentialRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class JpaCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCredentialStore.class);

    private final CredentialRepository repository;
    private final ObjectMapper om = new ObjectMapper();

    public JpaCredentialStore(CredentialRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CredentialSnapshot> find(String userId) {
        if (userId == null) return Optional.empty();
        return repository.findById(userId)
                .map(e -> new CredentialSnapshot(e.getCsrfToken(), fromJson(userId, e.getCookiesJson()), e.getCapturedAtEpochMs()));
    }

    @Override
    @Transactional
    public CredentialSnapshot save(String userId, String csrfToken, Map<String, String> cookies) {
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
        long now = System.currentTimeMillis();
        Map<String, String> safe = cookies == null ? Collections.emptyMap() : new LinkedHashMap<>(cookies);
        String json = toJson(safe);

        CredentialEntity entity = repository.findById(userId).orElse(null);
        if (entity == null) {
            entity = new CredentialEntity(userId, csrfToken, json, now);
        } else {
            entity.update(csrfToken, json, now);
        }
        repository.save(entity);

        log.info("Credentials stored. userId={} csrf={} cookies={}", userId, csrfToken != null, safe.keySet());
        return new CredentialSnapshot(csrfToken, safe, now);
    }

    private String toJson(Map<String, String> cookies) {
        try {
            return om.writeValueAsString(cookies);
        } catch (Exception e) {
            throw new IllegalStateException("cannot serialize cookies", e);
        }
    }

    private Map<String, String> fromJson(String userId, String json) {
        if (json == null || json.isBlank()) return Collections.emptyMap();
        try {
            return om.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {});
        } catch (Exception e) {
            // unreadable row is treated as "no cookies"; the server path then reports incomplete credentials
            log.warn("Stored cookies unreadable, ignoring. userId={} error={}", userId, e.toString());
            return Collections.emptyMap();
        }
    }
}
