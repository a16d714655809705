package com.phillippitts.bbdetector.service.detection;

import com.phillippitts.bbdetector.service.capture.Frame;
import com.phillippitts.bbdetector.service.state.SessionField;
import com.phillippitts.bbdetector.service.state.SharedState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventGateTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private final Frame frame = Frame.of(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB));
    private StubMatcher matcher;
    private SharedState state;
    private EventGate gate;

    @BeforeEach
    void setUp() {
        matcher = new StubMatcher();
        state = new SharedState();
        state.set(SessionField.CONNECTED, true);
        gate = new EventGate(matcher, state, Duration.ofSeconds(5));
    }

    @Test
    void matchProducesEventOncePerCooldownWindow() {
        matcher.confidence = 0.9;

        assertThat(gate.evaluate(frame, T0)).isPresent();
        assertThat(gate.evaluate(frame, T0.plusSeconds(1))).isEmpty();
        assertThat(gate.evaluate(frame, T0.plusMillis(4_999))).isEmpty();
        assertThat(gate.evaluate(frame, T0.plusSeconds(5))).isPresent();
        assertThat(gate.lastEventTime()).isEqualTo(T0.plusSeconds(5));
    }

    @Test
    void suppressedMatchesDoNotExtendCooldown() {
        matcher.confidence = 0.9;
        gate.evaluate(frame, T0);
        gate.evaluate(frame, T0.plusSeconds(4));

        assertThat(gate.evaluate(frame, T0.plusSeconds(6))).isPresent();
    }

    @Test
    void missProducesNothing() {
        matcher.confidence = 0.2;

        assertThat(gate.evaluate(frame, T0)).isEmpty();
        assertThat(gate.lastEventTime()).isNull();
    }

    @Test
    void disabledDetectionSkipsMatcher() {
        matcher.confidence = 0.9;
        state.set(SessionField.DETECTION_ENABLED, false);

        assertThat(gate.evaluate(frame, T0)).isEmpty();
        assertThat(matcher.calls).isZero();
    }

    @Test
    void disconnectedSkipsMatcher() {
        matcher.confidence = 0.9;
        state.set(SessionField.CONNECTED, false);

        assertThat(gate.evaluate(frame, T0)).isEmpty();
        assertThat(matcher.calls).isZero();
    }

    @Test
    void eventCarriesBossFlagAndConfidence() {
        matcher.confidence = 0.88;
        state.set(SessionField.BOSS_MODE, true);

        Optional<DeathEvent> event = gate.evaluate(frame, T0);

        assertThat(event).hasValueSatisfying(e -> {
            assertThat(e.boss()).isTrue();
            assertThat(e.confidence()).isEqualTo(0.88);
            assertThat(e.at()).isEqualTo(T0);
        });
    }

    @Test
    void requiresConsecutiveHitsWhenConfigured() {
        EventGate strict = new EventGate(matcher, state, Duration.ofSeconds(5), 3);
        matcher.confidence = 0.9;

        assertThat(strict.evaluate(frame, T0)).isEmpty();
        assertThat(strict.evaluate(frame, T0.plusMillis(100))).isEmpty();
        matcher.confidence = 0.1;
        assertThat(strict.evaluate(frame, T0.plusMillis(200))).isEmpty();
        matcher.confidence = 0.9;
        assertThat(strict.evaluate(frame, T0.plusMillis(300))).isEmpty();
        assertThat(strict.evaluate(frame, T0.plusMillis(400))).isEmpty();
        assertThat(strict.evaluate(frame, T0.plusMillis(500))).isPresent();
    }

    @Test
    void resetClearsCooldown() {
        matcher.confidence = 0.9;
        gate.evaluate(frame, T0);

        gate.reset();

        assertThat(gate.evaluate(frame, T0.plusSeconds(1))).isPresent();
    }

    @Test
    void replaceTemplateKeepsThresholdAndRestartsWindow() {
        matcher.confidence = 0.9;
        gate.evaluate(frame, T0);
        ReferenceTemplate replacement = ReferenceTemplate.of("new.png", new BufferedImage(16, 4,
                BufferedImage.TYPE_INT_RGB));

        gate.replaceTemplate(replacement);

        assertThat(matcher.reloaded).isSameAs(replacement);
        assertThat(matcher.reloadedThreshold).isEqualTo(0.75);
        assertThat(gate.lastEventTime()).isNull();
        assertThat(gate.evaluate(frame, T0.plusSeconds(1))).isPresent();
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new EventGate(matcher, state, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EventGate(matcher, state, Duration.ofSeconds(5), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static class StubMatcher implements Matcher {
        volatile double confidence;
        volatile int calls;
        volatile ReferenceTemplate reloaded;
        volatile double reloadedThreshold;

        @Override
        public double score(Frame frame, ReferenceTemplate template) {
            return confidence;
        }

        @Override
        public MatchResult isMatch(Frame frame) {
            calls++;
            return MatchResult.of(confidence, 0.75);
        }

        @Override
        public void reload(ReferenceTemplate template, double threshold) {
            reloaded = template;
            reloadedThreshold = threshold;
        }

        @Override
        public double threshold() {
            return 0.75;
        }

        @Override
        public ReferenceTemplate template() {
            return ReferenceTemplate.empty();
        }
    }
}
