package com.example.sessionrelay.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link DelegateTransport} over a Spring {@link WebSocketSession}. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator}, which gives the single-writer guarantee.
 */
public class WebSocketSessionTransport implements DelegateTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionTransport.class);

    private final WebSocketSession session;

    public WebSocketSessionTransport(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) return;
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.debug("close failed. sessionId={} error={}", session.getId(), e.toString());
        }
    }
}
