package com.example.sessionrelay.api;

import com.example.sessionrelay.model.CredentialSnapshot;
import com.example.sessionrelay.model.CredentialUpdateRequest;
import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.service.CredentialRefreshService;
import com.example.sessionrelay.service.CredentialStore;
import com.example.sessionrelay.web.ErrorStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/users/{userId}/credentials")
public class CredentialApiController {

    private final CredentialStore store;
    private final CredentialRefreshService refreshService;

    public CredentialApiController(CredentialStore store, CredentialRefreshService refreshService) {
        this.store = store;
        this.refreshService = refreshService;
    }

    /**
     * The extension pushes what it can read from the browser. Cookie values are never echoed back.
     */
    @PutMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> update(@PathVariable String userId, @RequestBody CredentialUpdateRequest req) {
        if (req == null) throw new IllegalArgumentException("body required");
        CredentialSnapshot saved = store.save(userId, req.getCsrfToken(), req.getCookies());
        return summary(userId, saved);
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> get(@PathVariable String userId) {
        return summary(userId, store.snapshot(userId));
    }

    @PostMapping(value = "/refresh", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExecutionResult> refresh(@PathVariable String userId,
                                                   @RequestParam(required = false) Long timeoutMs) {
        ExecutionResult result = refreshService.refresh(userId, timeoutMs == null ? null : Duration.ofMillis(timeoutMs));
        return ResponseEntity.status(ErrorStatus.of(result)).body(result);
    }

    private static Map<String, Object> summary(String userId, CredentialSnapshot s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("userId", userId);
        m.put("hasCsrfToken", s.getCsrfToken() != null);
        m.put("cookieNames", s.getCookies().keySet());
        m.put("completeForServerCall", s.isCompleteForServerCall());
        m.put("capturedAt", s.getCapturedAtEpochMs());
        return m;
    }
}
