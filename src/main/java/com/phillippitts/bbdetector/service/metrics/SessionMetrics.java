package com.phillippitts.bbdetector.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for detection and session sync.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Engine tick duration and overruns</li>
 *   <li>Detected deaths by kind (normal, boss) and source (detector, hotkey)</li>
 *   <li>Outbound commands by outcome (sent, dropped, failed)</li>
 *   <li>Reconnect attempts</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class SessionMetrics {

    private static final String METRIC_PREFIX = "bbdetector";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one engine tick took.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordTick(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".engine.tick")
                .description("Time spent in one engine tick")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /** Counts a tick that took longer than the tick interval. */
    public void incrementOverrun() {
        Counter.builder(METRIC_PREFIX + ".engine.overrun")
                .description("Ticks that exceeded the tick interval")
                .register(registry)
                .increment();
    }

    /**
     * Counts a death reported to the session.
     *
     * @param kind normal or boss
     * @param source detector or hotkey
     */
    public void incrementDeath(String kind, String source) {
        Counter.builder(METRIC_PREFIX + ".deaths")
                .description("Deaths reported to the session")
                .tag("kind", kind)
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * Counts an outbound command.
     *
     * @param type wire message type (bb-death, bb-boss-start, ...)
     * @param outcome sent, dropped (not authenticated) or failed (transport error)
     */
    public void incrementCommand(String type, String outcome) {
        Counter.builder(METRIC_PREFIX + ".sync.commands")
                .description("Outbound session commands by outcome")
                .tag("type", type)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /** Counts a scheduled reconnect. */
    public void incrementReconnect() {
        Counter.builder(METRIC_PREFIX + ".sync.reconnects")
                .description("Scheduled reconnect attempts")
                .register(registry)
                .increment();
    }

    /** Counts a tick skipped because no frame was available. */
    public void incrementCaptureMiss() {
        Counter.builder(METRIC_PREFIX + ".capture.miss")
                .description("Ticks without a frame")
                .register(registry)
                .increment();
    }
}
