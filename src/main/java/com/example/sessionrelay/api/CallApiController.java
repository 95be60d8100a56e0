package com.example.sessionrelay.api;

import com.example.sessionrelay.model.ExecutionPolicy;
import com.example.sessionrelay.model.ExecutionResult;
import com.example.sessionrelay.service.ExecutionRouter;
import com.example.sessionrelay.web.ErrorStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/users/{userId}")
public class CallApiController {

    private final ExecutionRouter router;

    public CallApiController(ExecutionRouter router) {
        this.router = router;
    }

    /**
     * Runs one upstream call for the user. The body holds the endpoint parameters; the response status mirrors
     * the result's error kind.
     */
    @PostMapping(value = "/calls/{endpoint}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExecutionResult> call(
            @PathVariable String userId,
            @PathVariable String endpoint,
            @RequestParam(required = false) String policy,
            @RequestParam(required = false) Long timeoutMs,
            @RequestBody(required = false) Map<String, Object> params
    ) {
        ExecutionResult result = router.execute(userId, endpoint, params, parsePolicy(policy),
                timeoutMs == null ? null : Duration.ofMillis(timeoutMs));
        return ResponseEntity.status(ErrorStatus.of(result)).body(result);
    }

    static ExecutionPolicy parsePolicy(String policy) {
        if (policy == null || policy.isBlank()) return null;
        try {
            return ExecutionPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("policy must be SERVER or DELEGATED: " + policy);
        }
    }
}
