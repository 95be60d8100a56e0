package com.example.sessionrelay.ws;

import com.example.sessionrelay.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pings every open connection and drops the ones that have gone quiet for longer than the liveness window.
 */
@Component
public class LivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    static final int CLOSE_UNRESPONSIVE = RelayConnection.CLOSE_UNRESPONSIVE;

    private final ConnectionRegistry registry;
    private final RelayMessageCodec codec;
    private final GatewayProperties properties;
    private final AtomicLong pingSeq = new AtomicLong();

    public LivenessMonitor(ConnectionRegistry registry, RelayMessageCodec codec, GatewayProperties properties) {
        this.registry = registry;
        this.codec = codec;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${relay.ping-interval:PT20S}")
    public void tick() {
        sweep(System.currentTimeMillis());
    }

    /**
     * @return number of connections dropped
     */
    public int sweep(long nowEpochMs) {
        long window = properties.getLivenessWindow().toMillis();
        int dropped = 0;
        for (RelayConnection conn : registry.openConnections()) {
            if (nowEpochMs - conn.getLastSeenEpochMs() > window) {
                log.warn("Relay connection unresponsive, dropping. userId={} connectionId={} idleMs={}",
                        conn.getUserId(), conn.getId(), nowEpochMs - conn.getLastSeenEpochMs());
                conn.drop(CLOSE_UNRESPONSIVE, "unresponsive");
                dropped++;
                continue;
            }
            try {
                conn.send(codec.ping(pingSeq.incrementAndGet()));
            } catch (IOException | RuntimeException e) {
                log.warn("Ping failed, dropping. userId={} connectionId={} error={}",
                        conn.getUserId(), conn.getId(), e.toString());
                conn.drop(CLOSE_UNRESPONSIVE, "ping failed");
                dropped++;
            }
        }
        return dropped;
    }
}
