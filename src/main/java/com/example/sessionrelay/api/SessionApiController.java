package com.example.sessionrelay.api;

import com.example.sessionrelay.persistence.UserSessionEntity;
import com.example.sessionrelay.service.SessionAuthService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated token issuance for local development. Any caller can obtain a token for any user id, and that
 * token takes over the user's delegate connection, so it is only mapped when {@code relay.local-login-enabled}
 * is true.
 */
@RestController
@ConditionalOnProperty(prefix = "relay", name = "local-login-enabled", havingValue = "true")
@RequestMapping("/api/v1/users/{userId}/sessions")
public class SessionApiController {

    private final SessionAuthService authService;

    public SessionApiController(SessionAuthService authService) {
        this.authService = authService;
    }

    /**
     * Local login: hands the extension the token it sends in its {@code auth} message.
     */
    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> issue(@PathVariable String userId) {
        UserSessionEntity s = authService.issue(userId);
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("userId", s.getUserId());
        m.put("sessionToken", s.getSessionToken());
        m.put("expiresAt", s.getExpiresAtEpochMs());
        return m;
    }
}
