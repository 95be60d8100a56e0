package com.example.sessionrelay.ws;

import com.example.sessionrelay.model.LogicalRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outstanding delegated calls of one connection, keyed by correlation id.
 * <p>
 * Three parties remove entries: the read loop on a matching response, the deadline timer, and connection
 * teardown. Each goes through an atomic {@code remove}, so an entry is handed to exactly one of them.
 * Insertion and teardown share the table lock, so nothing can be inserted after the table is drained.
 * Ids come from a monotonic counter and are never reused on the same connection.
 */
public class PendingCallTable {

    private final String idPrefix;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, PendingCall> calls = new ConcurrentHashMap<>();
    private boolean closed; // guarded by this

    public PendingCallTable(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    /**
     * Null once the table has been drained.
     */
    public synchronized PendingCall open(LogicalRequest request, long deadlineEpochMs, boolean http) {
        if (closed) return null;
        String id = idPrefix + "-" + sequence.incrementAndGet();
        PendingCall call = new PendingCall(id, request, deadlineEpochMs, http);
        calls.put(id, call);
        return call;
    }

    public PendingCall take(String correlationId) {
        return correlationId == null ? null : calls.remove(correlationId);
    }

    public synchronized List<PendingCall> closeAndDrain() {
        closed = true;
        List<PendingCall> drained = new ArrayList<>(calls.size());
        for (String id : new ArrayList<>(calls.keySet())) {
            PendingCall call = calls.remove(id);
            if (call != null) drained.add(call);
        }
        return drained;
    }

    public int size() {
        return calls.size();
    }
}
