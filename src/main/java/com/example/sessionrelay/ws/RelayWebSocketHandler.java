package com.example.sessionrelay.ws;

import com.example.sessionrelay.config.GatewayProperties;
import com.example.sessionrelay.exception.GatewayException;
import com.example.sessionrelay.service.SessionAuthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read side of the relay protocol. The browser authenticates with its first message; afterwards responses are
 * handed to the connection's pending calls. This loop never waits on a caller.
 */
@Component
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    static final int CODE_AUTH_FAILED = 4001;
    static final int CODE_PROTOCOL = RelayConnection.CODE_PROTOCOL;

    private final ConnectionRegistry registry;
    private final RelayMessageCodec codec;
    private final SessionAuthService authService;
    private final GatewayProperties properties;

    // Keep per-session state
    private final Map<String, SessionState> states = new ConcurrentHashMap<>();

    private static final class SessionState {
        final DelegateTransport transport;
        volatile RelayConnection connection; // null until auth

        SessionState(DelegateTransport transport) {
            this.transport = transport;
        }
    }

    public RelayWebSocketHandler(ConnectionRegistry registry, RelayMessageCodec codec,
                                 SessionAuthService authService, GatewayProperties properties) {
        this.registry = registry;
        this.codec = codec;
        this.authService = authService;
        this.properties = properties;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        DelegateTransport transport = new WebSocketSessionTransport(session,
                (int) properties.getSendTimeLimit().toMillis(), properties.getSendBufferBytes());
        states.put(session.getId(), new SessionState(transport));
        log.info("RELAY ws connected. sessionId={} remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SessionState st = states.get(session.getId());
        if (st == null) return;

        InboundMessage msg;
        try {
            msg = codec.decode(message.getPayload());
        } catch (GatewayException e) {
            protocolViolation(session, st, e.getMessage());
            return;
        }

        RelayConnection conn = st.connection;
        if (conn == null && msg.getType() != MessageType.AUTH) {
            protocolViolation(session, st, msg.getType().wire() + " before auth");
            return;
        }
        if (conn != null) conn.touch();

        switch (msg.getType()) {
            case AUTH:
                handleAuth(session, st, msg);
                break;
            case PING:
                reply(st, codec.pong(msg.getRoot().get("id"), System.currentTimeMillis()));
                break;
            case PONG:
                // liveness already recorded by touch()
                break;
            case RESPONSE:
                conn.onResponse(msg);
                break;
            case ERROR:
                log.warn("Client reported error. sessionId={} userId={} message={}",
                        session.getId(), conn.getUserId(), msg.text("message"));
                break;
            default:
                protocolViolation(session, st, "Unexpected message type: " + msg.getType().wire());
        }
    }

    private void handleAuth(WebSocketSession session, SessionState st, InboundMessage msg) {
        if (st.connection != null) {
            protocolViolation(session, st, "auth may only be sent once");
            return;
        }
        Optional<String> userId = authService.authenticate(msg.text("token"));
        if (userId.isEmpty()) {
            reply(st, codec.error("Authentication failed", CODE_AUTH_FAILED));
            st.transport.close(CloseStatus.POLICY_VIOLATION.getCode(), "Authentication failed");
            return;
        }
        st.connection = registry.register(userId.get(), st.transport);
        reply(st, codec.authSuccess(userId.get()));
        log.info("RELAY ws authenticated. sessionId={} userId={}", session.getId(), userId.get());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        SessionState st = states.get(session.getId());
        log.warn("RELAY ws transport error. sessionId={} error={}", session.getId(), exception.toString());
        if (st != null) drop(st, ConnectionState.DISCONNECTED, "transport error");
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        SessionState st = states.remove(session.getId());
        if (st != null) {
            boolean orderly = status.getCode() == CloseStatus.NORMAL.getCode()
                    || status.getCode() == CloseStatus.GOING_AWAY.getCode();
            drop(st, orderly ? ConnectionState.CLOSED : ConnectionState.DISCONNECTED, "closed " + status.getCode());
        }
        log.info("RELAY ws disconnected. sessionId={}, status={}", session.getId(), status);
    }

    private void protocolViolation(WebSocketSession session, SessionState st, String reason) {
        RelayConnection conn = st.connection;
        if (conn != null) {
            conn.protocolError(reason);
            return;
        }
        log.warn("Protocol error before auth, closing. sessionId={} reason={}", session.getId(), reason);
        reply(st, codec.error(reason, CODE_PROTOCOL));
        st.transport.close(CloseStatus.PROTOCOL_ERROR.getCode(), "Protocol error");
    }

    private void drop(SessionState st, ConnectionState finalState, String reason) {
        RelayConnection conn = st.connection;
        if (conn == null) return;
        registry.deregister(conn.getUserId(), st.transport);
        conn.terminate(finalState, reason);
    }

    private void reply(SessionState st, String json) {
        try {
            st.transport.send(json);
        } catch (IOException | RuntimeException e) {
            log.debug("reply failed. transport={} error={}", st.transport.id(), e.toString());
        }
    }
}
