package com.example.sessionrelay.config;

import com.example.sessionrelay.model.ExecutionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "relay")
public class GatewayProperties {

    /** Base of the upstream private API; GraphQL lives under {@code /graphql}. */
    private String upstreamBaseUrl = "https://www.linkedin.com/voyager/api";

    /** Used when a caller does not pass a timeout. */
    private Duration defaultTimeout = Duration.ofSeconds(60);

    /** Caller-supplied timeouts are clamped to this. */
    private Duration maxTimeout = Duration.ofMinutes(5);

    private Duration pingInterval = Duration.ofSeconds(20);

    /** A connection with no inbound traffic for this long is considered lost. */
    private Duration livenessWindow = Duration.ofSeconds(60);

    private ExecutionPolicy defaultPolicy = ExecutionPolicy.DELEGATED;

    private Map<String, ExecutionPolicy> userPolicies = new HashMap<>();

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    private int maxTextMessageBytes = 2 * 1024 * 1024;

    /** Outbound queue limit per connection before the decorator gives up on a slow client. */
    private int sendBufferBytes = 4 * 1024 * 1024;

    private Duration sendTimeLimit = Duration.ofSeconds(10);

    /** Lifetime of locally issued relay session tokens. */
    private Duration sessionTtl = Duration.ofDays(730);

    /** Exposes the unauthenticated token issuance endpoint; local development only. */
    private boolean localLoginEnabled = false;

    public String getUpstreamBaseUrl() { return upstreamBaseUrl; }
    public void setUpstreamBaseUrl(String upstreamBaseUrl) { this.upstreamBaseUrl = upstreamBaseUrl; }

    public Duration getDefaultTimeout() { return defaultTimeout; }
    public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }

    public Duration getMaxTimeout() { return maxTimeout; }
    public void setMaxTimeout(Duration maxTimeout) { this.maxTimeout = maxTimeout; }

    public Duration getPingInterval() { return pingInterval; }
    public void setPingInterval(Duration pingInterval) { this.pingInterval = pingInterval; }

    public Duration getLivenessWindow() { return livenessWindow; }
    public void setLivenessWindow(Duration livenessWindow) { this.livenessWindow = livenessWindow; }

    public ExecutionPolicy getDefaultPolicy() { return defaultPolicy; }
    public void setDefaultPolicy(ExecutionPolicy defaultPolicy) { this.defaultPolicy = defaultPolicy; }

    public Map<String, ExecutionPolicy> getUserPolicies() { return userPolicies; }
    public void setUserPolicies(Map<String, ExecutionPolicy> userPolicies) { this.userPolicies = userPolicies; }

    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }

    public int getMaxTextMessageBytes() { return maxTextMessageBytes; }
    public void setMaxTextMessageBytes(int maxTextMessageBytes) { this.maxTextMessageBytes = maxTextMessageBytes; }

    public int getSendBufferBytes() { return sendBufferBytes; }
    public void setSendBufferBytes(int sendBufferBytes) { this.sendBufferBytes = sendBufferBytes; }

    public Duration getSendTimeLimit() { return sendTimeLimit; }
    public void setSendTimeLimit(Duration sendTimeLimit) { this.sendTimeLimit = sendTimeLimit; }

    public Duration getSessionTtl() { return sessionTtl; }
    public void setSessionTtl(Duration sessionTtl) { this.sessionTtl = sessionTtl; }

    public boolean isLocalLoginEnabled() { return localLoginEnabled; }
    public void setLocalLoginEnabled(boolean localLoginEnabled) { this.localLoginEnabled = localLoginEnabled; }

    /**
     * Clamp a caller timeout into (0, maxTimeout]; null or non-positive means the default.
     */
    public Duration effectiveTimeout(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) return defaultTimeout;
        return requested.compareTo(maxTimeout) > 0 ? maxTimeout : requested;
    }
}
