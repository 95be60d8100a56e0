package com.example.sessionrelay.ws;

import java.io.IOException;

/**
 * Duplex channel to a browser-side executor. Implementations must serialize concurrent {@link #send} calls.
 */
public interface DelegateTransport {

    String id();

    void send(String text) throws IOException;

    boolean isOpen();

    void close(int code, String reason);
}
