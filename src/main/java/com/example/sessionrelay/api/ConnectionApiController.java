package com.example.sessionrelay.api;

import com.example.sessionrelay.model.ConnectionStatusResponse;
import com.example.sessionrelay.model.NotificationRequest;
import com.example.sessionrelay.ws.ConnectionRegistry;
import com.example.sessionrelay.ws.DelegationService;
import com.example.sessionrelay.ws.RelayConnection;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
public class ConnectionApiController {

    private final ConnectionRegistry registry;
    private final DelegationService delegation;

    public ConnectionApiController(ConnectionRegistry registry, DelegationService delegation) {
        this.registry = registry;
        this.delegation = delegation;
    }

    @GetMapping(value = "/connections", produces = MediaType.APPLICATION_JSON_VALUE)
    public ConnectionStatusResponse connections() {
        List<ConnectionStatusResponse.Entry> entries = registry.openConnections().stream()
                .map(ConnectionApiController::toEntry)
                .collect(Collectors.toList());
        return new ConnectionStatusResponse(entries.size(), entries);
    }

    @GetMapping(value = "/connections/{userId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ConnectionStatusResponse.Entry connection(@PathVariable String userId) {
        return registry.lookup(userId)
                .map(ConnectionApiController::toEntry)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "no open connection for user: " + userId));
    }

    @PostMapping(value = "/users/{userId}/notifications", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> notify(@PathVariable String userId, @RequestBody NotificationRequest req) {
        if (req == null || req.getMessage() == null || req.getMessage().isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        boolean delivered = delegation.notify(userId, req);
        Map<String, Object> m = new HashMap<>();
        m.put("userId", userId);
        m.put("delivered", delivered);
        return ResponseEntity.status(delivered ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(m);
    }

    private static ConnectionStatusResponse.Entry toEntry(RelayConnection c) {
        return new ConnectionStatusResponse.Entry(c.getUserId(), c.getId(), c.getState().name(),
                c.pendingCount(), c.getOpenedAtEpochMs(), c.getLastSeenEpochMs());
    }
}
