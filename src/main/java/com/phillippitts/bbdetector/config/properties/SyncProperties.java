package com.phillippitts.bbdetector.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed properties for the live session connection.
 *
 * <p>The connection target is {@code url} plus the {@code route} query parameters plus
 * {@code profile=<name>}. Reconnection always reuses the same target.
 */
@Validated
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    public static final String DEFAULT_URL = "wss://soulsdeaths.somework.dev/ws";

    /** WebSocket endpoint without query string. */
    @NotBlank
    private final String url;

    /** Fixed query parameters that route the connection to the tracker (bloodborne=true). */
    private final Map<String, String> route;

    /** Profile name; empty selects the server's default profile. */
    private final String profile;

    /** Profile password used for the one automatic authentication attempt per connection. */
    private final String password;

    /** Connect as soon as the application starts. */
    private final boolean autoConnect;

    /** First reconnect delay; doubled after each failed attempt. */
    private final Duration reconnectDelay;

    /** Upper bound for the reconnect delay. */
    private final Duration maxReconnectDelay;

    /** Outbound write timeout; a stalled send fails the connection instead of blocking. */
    private final Duration sendTimeout;

    /** Transport-level ping interval; zero disables pings. */
    private final Duration pingInterval;

    @ConstructorBinding
    public SyncProperties(String url,
                          Map<String, String> route,
                          String profile,
                          String password,
                          Boolean autoConnect,
                          Duration reconnectDelay,
                          Duration maxReconnectDelay,
                          Duration sendTimeout,
                          Duration pingInterval) {
        this.url = (url == null || url.isBlank()) ? DEFAULT_URL : url;
        this.route = (route == null || route.isEmpty())
                ? Map.of("bloodborne", "true")
                : Map.copyOf(new LinkedHashMap<>(route));
        this.profile = profile == null ? "" : profile.trim();
        this.password = password == null ? "" : password;
        this.autoConnect = autoConnect == null || autoConnect;
        this.reconnectDelay = positiveOr(reconnectDelay, Duration.ofSeconds(3));
        Duration max = positiveOr(maxReconnectDelay, Duration.ofSeconds(30));
        this.maxReconnectDelay = max.compareTo(this.reconnectDelay) < 0 ? this.reconnectDelay : max;
        this.sendTimeout = positiveOr(sendTimeout, Duration.ofSeconds(2));
        this.pingInterval = (pingInterval == null || pingInterval.isNegative())
                ? Duration.ofSeconds(20) : pingInterval;
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return (value == null || value.isZero() || value.isNegative()) ? fallback : value;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getRoute() {
        return route;
    }

    public String getProfile() {
        return profile;
    }

    public String getPassword() {
        return password;
    }

    public boolean isAutoConnect() {
        return autoConnect;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public Duration getMaxReconnectDelay() {
        return maxReconnectDelay;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    public Duration getPingInterval() {
        return pingInterval;
    }

    @Override
    public String toString() {
        // password deliberately omitted
        return "SyncProperties{url=" + url + ", route=" + route + ", profile='" + profile
                + "', autoConnect=" + autoConnect + ", reconnectDelay=" + reconnectDelay
                + ", maxReconnectDelay=" + maxReconnectDelay + '}';
    }
}
