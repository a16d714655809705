package com.phillippitts.bbdetector.service.detection;

import com.phillippitts.bbdetector.service.capture.Frame;
import com.phillippitts.bbdetector.service.state.SessionSnapshot;
import com.phillippitts.bbdetector.service.state.SharedState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns per-tick similarity scores into at most one {@link DeathEvent} per cooldown window.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>Policy gate: detection disabled or not connected → nothing, matcher not queried</li>
 *   <li>Matcher miss → nothing (and the hit streak resets)</li>
 *   <li>Streak below {@code requiredHits} → nothing yet</li>
 *   <li>Inside the cooldown window → silently suppressed (the death screen stays up for seconds)</li>
 *   <li>Otherwise the event fires, tagged with boss mode, and the window restarts</li>
 * </ol>
 *
 * <p>Session flags are sampled once per evaluation from a single snapshot. The gate has no
 * idea how events are delivered.
 */
public class EventGate {

    private static final Logger LOG = LogManager.getLogger(EventGate.class);

    private final Matcher matcher;
    private final SharedState state;
    private final Duration cooldown;
    private final int requiredHits;

    private Instant lastEventTime;
    private int streak;

    public EventGate(Matcher matcher, SharedState state, Duration cooldown, int requiredHits) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.state = Objects.requireNonNull(state, "state");
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
        if (requiredHits < 1) {
            throw new IllegalArgumentException("requiredHits must be >= 1, got " + requiredHits);
        }
        this.requiredHits = requiredHits;
    }

    public EventGate(Matcher matcher, SharedState state, Duration cooldown) {
        this(matcher, state, cooldown, 1);
    }

    public synchronized Optional<DeathEvent> evaluate(Frame frame, Instant now) {
        SessionSnapshot session = state.snapshot();
        if (!session.detectionEnabled() || !session.connected()) {
            streak = 0;
            return Optional.empty();
        }

        MatchResult result = matcher.isMatch(frame);
        if (!result.matched()) {
            streak = 0;
            return Optional.empty();
        }
        if (++streak < requiredHits) {
            return Optional.empty();
        }
        streak = 0;

        if (lastEventTime != null && Duration.between(lastEventTime, now).compareTo(cooldown) < 0) {
            LOG.trace("Match suppressed by cooldown (last event {})", lastEventTime);
            return Optional.empty();
        }
        lastEventTime = now;
        DeathEvent event = new DeathEvent(now, session.bossMode(), result.confidence());
        LOG.info("Death detected: boss={}, confidence={}", event.boss(), String.format("%.3f", event.confidence()));
        return Optional.of(event);
    }

    /**
     * Swaps the reference template, keeping the current threshold, and restarts the streak and
     * cooldown window so a match against the old template cannot suppress the new one.
     */
    public synchronized void replaceTemplate(ReferenceTemplate template) {
        matcher.reload(template, matcher.threshold());
        reset();
        LOG.info("Template replaced with {}", template);
    }

    /** Clears the hit streak and the cooldown window, e.g. after the template changed. */
    public synchronized void reset() {
        streak = 0;
        lastEventTime = null;
    }

    public synchronized Instant lastEventTime() {
        return lastEventTime;
    }

    public Duration cooldown() {
        return cooldown;
    }
}
