package com.example.sessionrelay.service;

import com.example.sessionrelay.model.CredentialSnapshot;

import java.util.Map;
import java.util.Optional;

/**
 * Where the gateway reads a user's partial credential set from. Snapshots handed out are immutable.
 */
public interface CredentialStore {

    Optional<CredentialSnapshot> find(String userId);

    /**
     * Stored snapshot, or an empty one when nothing is known about the user.
     */
    default CredentialSnapshot snapshot(String userId) {
        return find(userId).orElse(CredentialSnapshot.empty());
    }

    /**
     * Replaces what is stored for the user. Called by the browser-side push and by session refresh,
     * never by the execution paths.
     */
    CredentialSnapshot save(String userId, String csrfToken, Map<String, String> cookies);
}
