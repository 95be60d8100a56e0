package com.example.sessionrelay.model;

import java.util.List;

public class ConnectionStatusResponse {

    public static class Entry {
        private final String userId;
        private final String connectionId;
        private final String state;
        private final int pendingCalls;
        private final long openedAtEpochMs;
        private final long lastSeenEpochMs;

        public Entry(String userId, String connectionId, String state, int pendingCalls,
                     long openedAtEpochMs, long lastSeenEpochMs) {
            this.userId = userId;
            this.connectionId = connectionId;
            this.state = state;
            this.pendingCalls = pendingCalls;
            this.openedAtEpochMs = openedAtEpochMs;
            this.lastSeenEpochMs = lastSeenEpochMs;
        }

        public String getUserId() { return userId; }
        public String getConnectionId() { return connectionId; }
        public String getState() { return state; }
        public int getPendingCalls() { return pendingCalls; }
        public long getOpenedAtEpochMs() { return openedAtEpochMs; }
        public long getLastSeenEpochMs() { return lastSeenEpochMs; }
    }

    private final int connections;
    private final List<Entry> entries;

    public ConnectionStatusResponse(int connections, List<Entry> entries) {
        this.connections = connections;
        this.entries = entries;
    }

    public int getConnections() { return connections; }
    public List<Entry> getEntries() { return entries; }
}
