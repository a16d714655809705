package com.phillippitts.bbdetector.service.engine;

import com.phillippitts.bbdetector.config.properties.DetectionProperties;
import com.phillippitts.bbdetector.config.properties.EngineProperties;
import com.phillippitts.bbdetector.service.capture.CaptureErrorEvent;
import com.phillippitts.bbdetector.service.capture.Frame;
import com.phillippitts.bbdetector.service.capture.FrameSource;
import com.phillippitts.bbdetector.service.detection.EventGate;
import com.phillippitts.bbdetector.service.detection.MatchResult;
import com.phillippitts.bbdetector.service.detection.Matcher;
import com.phillippitts.bbdetector.service.detection.ReferenceTemplate;
import com.phillippitts.bbdetector.service.detection.TemplateLoader;
import com.phillippitts.bbdetector.service.engine.event.DeathDetectedEvent;
import com.phillippitts.bbdetector.service.engine.event.DisplayModeToggledEvent;
import com.phillippitts.bbdetector.service.metrics.SessionMetrics;
import com.phillippitts.bbdetector.service.state.SessionField;
import com.phillippitts.bbdetector.service.state.SharedState;
import com.phillippitts.bbdetector.service.sync.CharacterStats;
import com.phillippitts.bbdetector.service.sync.Milestone;
import com.phillippitts.bbdetector.service.sync.SyncClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.DefaultResourceLoader;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EngineLoopTest {

    private static final Instant T0 = Instant.parse("2024-05-01T20:00:00Z");

    private FakeFrames frames;
    private Matcher matcher;
    private SyncClient sync;
    private SharedState state;
    private SimpleMeterRegistry registry;
    private final List<Object> events = new CopyOnWriteArrayList<>();
    private EventGate gate;
    private EngineLoop engine;

    @BeforeEach
    void setUp() {
        frames = new FakeFrames();
        matcher = mock(Matcher.class);
        when(matcher.isMatch(any())).thenReturn(MatchResult.of(0.2, 0.75));
        sync = mock(SyncClient.class);
        state = new SharedState(Clock.fixed(T0, ZoneOffset.UTC), (l, f, e) -> { });
        state.set(SessionField.CONNECTED, true);
        registry = new SimpleMeterRegistry();
        engine = engine(detection(null), true);
        engine.acceptCommands();
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    private static DetectionProperties detection(DetectionProperties.Region region) {
        return new DetectionProperties(20, 5, 0.75, 1, 0, region, "", true);
    }

    private EngineLoop engine(DetectionProperties detection, boolean autoStart) {
        ApplicationEventPublisher publisher = events::add;
        gate = new EventGate(matcher, state, Duration.ofSeconds(5));
        TemplateLoader templates = new TemplateLoader(new DefaultResourceLoader());
        return new EngineLoop(frames, gate, templates, sync, state, detection, new EngineProperties(autoStart),
                publisher, new SessionMetrics(registry), Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void manualDeathFollowsBossMode() {
        engine.submit(EngineCommand.of(EngineCommand.Type.MANUAL_DEATH, "hotkey"));
        engine.tickOnce(T0);
        state.set(SessionField.BOSS_MODE, true);
        engine.submit(EngineCommand.of(EngineCommand.Type.MANUAL_DEATH, "hotkey"));
        engine.tickOnce(T0.plusSeconds(1));

        verify(sync).reportDeath();
        verify(sync).reportBossDeath();
        assertThat(registry.find("bbdetector.deaths").tag("kind", "boss").tag("source", "hotkey").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void toggleBossStartsOrCancels() {
        engine.submit(EngineCommand.of(EngineCommand.Type.TOGGLE_BOSS, "hotkey"));
        engine.tickOnce(T0);
        verify(sync).bossStart();
        verify(sync, never()).bossCancel();

        state.set(SessionField.BOSS_MODE, true);
        engine.submit(EngineCommand.of(EngineCommand.Type.TOGGLE_BOSS, "hotkey"));
        engine.tickOnce(T0);
        verify(sync).bossCancel();
    }

    @Test
    void toggleDetectionFlipsLocalFlag() {
        engine.submit(EngineCommand.of(EngineCommand.Type.TOGGLE_DETECTION, "hotkey"));
        engine.tickOnce(T0);
        assertThat(state.get(SessionField.DETECTION_ENABLED)).isFalse();

        engine.submit(EngineCommand.of(EngineCommand.Type.TOGGLE_DETECTION, "hotkey"));
        engine.tickOnce(T0);
        assertThat(state.get(SessionField.DETECTION_ENABLED)).isTrue();
        verifyNoInteractions(sync);
    }

    @Test
    void toggleDisplayModePublishesEvent() {
        engine.submit(EngineCommand.of(EngineCommand.Type.TOGGLE_DISPLAY_MODE, "hotkey"));
        engine.tickOnce(T0);

        assertThat(events).hasAtLeastOneElementOfType(DisplayModeToggledEvent.class);
    }

    @Test
    void sessionCommandsMapToSyncCalls() {
        engine.submit(EngineCommand.of(EngineCommand.Type.START_TIMER, "rest"));
        engine.submit(EngineCommand.of(EngineCommand.Type.STOP_TIMER, "rest"));
        engine.submit(EngineCommand.of(EngineCommand.Type.RESET_TIMER, "rest"));
        engine.submit(EngineCommand.of(EngineCommand.Type.BOSS_PAUSE, "rest"));
        engine.submit(EngineCommand.of(EngineCommand.Type.BOSS_RESUME, "rest"));
        engine.submit(EngineCommand.bossVictory("Ludwig", "rest"));
        engine.submit(EngineCommand.setElapsed(90_000L, "rest"));
        engine.submit(EngineCommand.setDeaths(12, "rest"));

        engine.tickOnce(T0);

        verify(sync).startTimer();
        verify(sync).stopTimer();
        verify(sync).resetTimer();
        verify(sync).bossPause();
        verify(sync).bossResume();
        verify(sync).bossVictory("Ludwig");
        verify(sync).setElapsed(90_000L);
        verify(sync).setDeaths(12);
        assertThat(engine.pendingCommands()).isZero();
    }

    @Test
    void milestoneAndStatsCommandsMapToSyncCalls() {
        CharacterStats stats = new CharacterStats(50, 30, 20, 12, 40, 9, 8);
        engine.submit(EngineCommand.addMilestone("Father Gascoigne", null, "api"));
        engine.submit(EngineCommand.editMilestone(new Milestone("m1", "Gascoigne", "⚔", 61_000L), "api"));
        engine.submit(EngineCommand.deleteMilestone("m2", "api"));
        engine.submit(EngineCommand.addStats(stats, "api"));
        engine.submit(EngineCommand.editStats("s1", stats, "api"));
        engine.submit(EngineCommand.deleteStats("s2", "api"));

        engine.tickOnce(T0);

        verify(sync).addMilestone("Father Gascoigne", null);
        verify(sync).editMilestone("m1", "Gascoigne", "⚔", 61_000L);
        verify(sync).deleteMilestone("m2");
        verify(sync).addStats(stats);
        verify(sync).editStats("s1", stats);
        verify(sync).deleteStats("s2");
    }

    @Test
    void reloadTemplateSwapsTemplateAndRestartsCooldown(@TempDir Path dir) throws IOException {
        Path png = dir.resolve("you-died.png");
        ImageIO.write(new BufferedImage(32, 8, BufferedImage.TYPE_INT_RGB), "png", png.toFile());
        when(matcher.threshold()).thenReturn(0.8);
        when(matcher.isMatch(any())).thenReturn(MatchResult.of(0.91, 0.75));
        engine.tickOnce(T0);
        assertThat(gate.lastEventTime()).isEqualTo(T0);

        engine.submit(EngineCommand.reloadTemplate(png.toString(), "api"));
        when(matcher.isMatch(any())).thenReturn(MatchResult.of(0.2, 0.75));
        engine.tickOnce(T0.plusSeconds(1));

        verify(matcher).reload(argThat((ReferenceTemplate t) -> t.sourceWidth() == 32), eq(0.8));
        assertThat(gate.lastEventTime()).isNull();
    }

    @Test
    void unreadableTemplateKeepsCurrentOne() {
        engine.submit(EngineCommand.reloadTemplate("/nowhere/you-died.png", "api"));
        engine.submit(EngineCommand.of(EngineCommand.Type.START_TIMER, "api"));

        engine.tickOnce(T0);

        verify(matcher, never()).reload(any(), anyDouble());
        verify(sync).startTimer();
    }

    @Test
    void rejectsCommandsWhileNotRunning() {
        EngineLoop idle = engine(detection(null), false);

        assertThat(idle.submit(EngineCommand.of(EngineCommand.Type.MANUAL_DEATH, "api"))).isFalse();
        idle.tickOnce(T0);

        assertThat(idle.pendingCommands()).isZero();
        verify(sync, never()).reportDeath();
    }

    @Test
    void stoppedEngineRejectsAndNeverReplaysOldCommands() {
        engine.submit(EngineCommand.of(EngineCommand.Type.MANUAL_DEATH, "hotkey"));
        engine.submit(EngineCommand.of(EngineCommand.Type.TOGGLE_DETECTION, "hotkey"));

        engine.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> engine.tickCount() >= 2);
        engine.stop();

        assertThat(engine.submit(EngineCommand.of(EngineCommand.Type.MANUAL_DEATH, "hotkey"))).isFalse();
        assertThat(engine.pendingCommands()).isZero();
        verify(sync, never()).reportDeath();
        assertThat(state.get(SessionField.DETECTION_ENABLED)).isTrue();
    }

    @Test
    void failingCommandDoesNotBlockLaterOnes() {
        when(sync.startTimer()).thenThrow(new IllegalStateException("boom"));
        engine.submit(EngineCommand.of(EngineCommand.Type.START_TIMER, "rest"));
        engine.submit(EngineCommand.of(EngineCommand.Type.STOP_TIMER, "rest"));

        engine.tickOnce(T0);

        verify(sync).stopTimer();
    }

    @Test
    void commandQueueIsBounded() {
        for (int i = 0; i < EngineLoop.MAX_PENDING_COMMANDS; i++) {
            assertThat(engine.submit(EngineCommand.of(EngineCommand.Type.RESET_TIMER, "rest"))).isTrue();
        }

        assertThat(engine.submit(EngineCommand.of(EngineCommand.Type.RESET_TIMER, "rest"))).isFalse();
        engine.tickOnce(T0);
        assertThat(engine.pendingCommands()).isZero();
        assertThat(engine.submit(EngineCommand.of(EngineCommand.Type.RESET_TIMER, "rest"))).isTrue();
    }

    @Test
    void displayElapsedExtrapolatesOnlyWhileRunning() {
        state.set(SessionField.ELAPSED_MS, 10_000L);

        engine.tickOnce(T0.plusMillis(1_500));
        assertThat(state.get(SessionField.DISPLAY_ELAPSED_MS)).isEqualTo(10_000L);

        state.set(SessionField.RUNNING, true);
        engine.tickOnce(T0.plusMillis(1_500));
        assertThat(state.get(SessionField.DISPLAY_ELAPSED_MS)).isEqualTo(11_500L);
        assertThat(state.get(SessionField.ELAPSED_MS)).isEqualTo(10_000L);
    }

    @Test
    void detectedDeathIsReportedAndPublished() {
        when(matcher.isMatch(any())).thenReturn(MatchResult.of(0.91, 0.75));
        when(sync.reportDeath()).thenReturn(true);

        engine.tickOnce(T0);
        engine.tickOnce(T0.plusMillis(100));

        verify(sync).reportDeath();
        assertThat(engine.detectionCount()).isEqualTo(1);
        assertThat(events).filteredOn(DeathDetectedEvent.class::isInstance)
                .singleElement()
                .satisfies(e -> {
                    DeathDetectedEvent d = (DeathDetectedEvent) e;
                    assertThat(d.boss()).isFalse();
                    assertThat(d.sent()).isTrue();
                });
    }

    @Test
    void detectedDeathInBossFightIsBossDeath() {
        when(matcher.isMatch(any())).thenReturn(MatchResult.of(0.91, 0.75));
        state.set(SessionField.BOSS_MODE, true);

        engine.tickOnce(T0);

        verify(sync).reportBossDeath();
        verify(sync, never()).reportDeath();
    }

    @Test
    void unavailableCaptureSkipsDetection() {
        frames.available = false;

        engine.tickOnce(T0);

        verifyNoInteractions(matcher);
        assertThat(frames.grabs).isZero();
        assertThat(engine.tickCount()).isEqualTo(1);
        assertThat(registry.find("bbdetector.capture.miss").counter().count()).isEqualTo(1.0);
    }

    @Test
    void lostCaptureIsReportedOnce() {
        frames.next = null;

        engine.tickOnce(T0);
        engine.tickOnce(T0.plusMillis(50));

        assertThat(events).filteredOn(CaptureErrorEvent.class::isInstance).hasSize(1);
    }

    @Test
    void grabFailureIsTreatedAsMissingFrame() {
        frames.failure = new IllegalStateException("display gone");

        engine.tickOnce(T0);

        verifyNoInteractions(matcher);
        assertThat(engine.tickCount()).isEqualTo(1);
    }

    @Test
    void configuredRegionIsCaptured() {
        EngineLoop regional = engine(detection(new DetectionProperties.Region(100, 50, 400, 120)), true);

        regional.tickOnce(T0);

        assertThat(frames.regions).containsExactly(List.of(100, 50, 400, 120));
        assertThat(frames.grabs).isZero();
    }

    @Test
    void runsTicksUntilStopped() {
        engine.start();

        await().atMost(Duration.ofSeconds(2)).until(() -> engine.tickCount() >= 3);
        engine.stop();
        long afterStop = engine.tickCount();

        assertThat(engine.isRunning()).isFalse();
        assertThat(engine.tickCount()).isEqualTo(afterStop);
        assertThat(engine.tickInterval()).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    void commandsSubmittedWhileRunningAreExecuted() {
        engine.start();

        engine.submit(EngineCommand.of(EngineCommand.Type.START_TIMER, "rest"));

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> verify(sync).startTimer());
    }

    @Test
    void startWithoutCaptureWarnsButRuns() {
        frames.available = false;

        engine.start();

        assertThat(engine.isRunning()).isTrue();
        assertThat(events).hasAtLeastOneElementOfType(CaptureErrorEvent.class);
    }

    @Test
    void autoStartFollowsProperties() {
        assertThat(engine.isAutoStartup()).isTrue();
        assertThat(engine(detection(null), false).isAutoStartup()).isFalse();
        assertThat(engine.getPhase()).isEqualTo(EngineLoop.PHASE);
    }

    static class FakeFrames implements FrameSource {
        volatile boolean available = true;
        volatile Frame next = Frame.of(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB));
        volatile RuntimeException failure;
        volatile int grabs;
        final List<List<Integer>> regions = Collections.synchronizedList(new ArrayList<>());

        @Override
        public Optional<Frame> grab() {
            grabs++;
            if (failure != null) {
                throw failure;
            }
            return Optional.ofNullable(next);
        }

        @Override
        public Optional<Frame> grabRegion(int x, int y, int width, int height) {
            regions.add(List.of(x, y, width, height));
            if (failure != null) {
                throw failure;
            }
            return Optional.ofNullable(next);
        }

        @Override
        public boolean isAvailable() {
            return available;
        }
    }
}
