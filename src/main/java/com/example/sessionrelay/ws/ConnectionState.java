package com.example.sessionrelay.ws;

public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED,
    /** Transport lost without an orderly close (liveness expiry, transport error, protocol teardown). */
    DISCONNECTED;

    public boolean isTerminal() {
        return this == CLOSED || this == DISCONNECTED;
    }
}
