package com.phillippitts.bbdetector.service.engine;

import com.phillippitts.bbdetector.config.properties.DetectionProperties;
import com.phillippitts.bbdetector.config.properties.EngineProperties;
import com.phillippitts.bbdetector.service.capture.CaptureErrorEvent;
import com.phillippitts.bbdetector.service.capture.Frame;
import com.phillippitts.bbdetector.service.capture.FrameSource;
import com.phillippitts.bbdetector.service.detection.DeathEvent;
import com.phillippitts.bbdetector.service.detection.EventGate;
import com.phillippitts.bbdetector.service.detection.ReferenceTemplate;
import com.phillippitts.bbdetector.service.detection.TemplateLoader;
import com.phillippitts.bbdetector.service.engine.event.DeathDetectedEvent;
import com.phillippitts.bbdetector.service.engine.event.DisplayModeToggledEvent;
import com.phillippitts.bbdetector.service.metrics.SessionMetrics;
import com.phillippitts.bbdetector.service.state.SessionField;
import com.phillippitts.bbdetector.service.state.SessionSnapshot;
import com.phillippitts.bbdetector.service.state.SharedState;
import com.phillippitts.bbdetector.service.sync.Milestone;
import com.phillippitts.bbdetector.service.sync.SyncClient;
import com.phillippitts.bbdetector.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-cadence loop that drives capture, detection and command dispatch on one thread.
 *
 * <p>Each tick:
 * <ol>
 *   <li>Drain queued {@link EngineCommand}s (hotkeys, REST) in arrival order</li>
 *   <li>Refresh the derived {@code displayElapsedMs} from the last authoritative {@code elapsedMs}</li>
 *   <li>Grab a frame; skip the rest of the tick if none is available</li>
 *   <li>{@link EventGate#evaluate} and translate a {@link DeathEvent} into
 *       {@link SyncClient#reportBossDeath()} or {@link SyncClient#reportDeath()}</li>
 * </ol>
 *
 * <p>This is the single consumer of the command queue, so every session mutation requested by
 * a user runs here. When a tick takes longer than the interval the loop starts the next one
 * immediately and counts the overrun; it never tries to catch up on missed ticks.
 *
 * <p>Commands are accepted only while the loop runs. Stopping lets the current tick finish,
 * prevents any new tick from starting and discards commands that were never executed, so
 * nothing queued before a stop replays after the next start.
 */
@Service
public class EngineLoop implements SmartLifecycle, CommandChannel {

    private static final Logger LOG = LogManager.getLogger(EngineLoop.class);

    /** Stopped after the hotkey router, before the sync client. */
    public static final int PHASE = 200;

    static final int MAX_PENDING_COMMANDS = 64;
    private static final long STOP_JOIN_MILLIS = 2_000;

    private final FrameSource frames;
    private final EventGate gate;
    private final TemplateLoader templates;
    private final SyncClient sync;
    private final SharedState state;
    private final DetectionProperties detection;
    private final EngineProperties engine;
    private final ApplicationEventPublisher publisher;
    private final SessionMetrics metrics;
    private final Clock clock;
    private final Duration tickInterval;

    private final Queue<EngineCommand> commands = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final Object sleepMonitor = new Object();
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong overruns = new AtomicLong();
    private final AtomicLong detections = new AtomicLong();

    private volatile boolean running;
    private volatile boolean accepting;
    private volatile boolean captureAvailable = true;
    private Thread worker;

    @Autowired
    public EngineLoop(FrameSource frames,
                      EventGate gate,
                      TemplateLoader templates,
                      SyncClient sync,
                      SharedState state,
                      DetectionProperties detection,
                      EngineProperties engine,
                      ApplicationEventPublisher publisher,
                      SessionMetrics metrics) {
        this(frames, gate, templates, sync, state, detection, engine, publisher, metrics, Clock.systemUTC());
    }

    // Package-private for tests
    EngineLoop(FrameSource frames,
               EventGate gate,
               TemplateLoader templates,
               SyncClient sync,
               SharedState state,
               DetectionProperties detection,
               EngineProperties engine,
               ApplicationEventPublisher publisher,
               SessionMetrics metrics,
               Clock clock) {
        this.frames = Objects.requireNonNull(frames, "frames");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.templates = Objects.requireNonNull(templates, "templates");
        this.sync = Objects.requireNonNull(sync, "sync");
        this.state = Objects.requireNonNull(state, "state");
        this.detection = Objects.requireNonNull(detection, "detection");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tickInterval = TimeUtils.tickInterval(detection.getFps());
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!frames.isAvailable()) {
            captureAvailable = false;
            publisher.publishEvent(new CaptureErrorEvent("screen capture unavailable", Instant.now()));
        }
        discardPendingCommands();
        running = true;
        accepting = true;
        worker = new Thread(this::runLoop, "engine-tick");
        worker.setDaemon(true);
        worker.start();
        LOG.info("EngineLoop started at {} fps (interval {} ms, region={})", detection.getFps(),
                tickInterval.toMillis(), detection.hasRegion() ? detection.getRegion() : "full monitor");
    }

    @Override
    public void stop() {
        Thread t;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            accepting = false;
            t = worker;
            worker = null;
        }
        synchronized (sleepMonitor) {
            sleepMonitor.notifyAll();
        }
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(STOP_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                LOG.warn("Engine tick did not finish within {} ms", STOP_JOIN_MILLIS);
            }
        }
        int dropped = discardPendingCommands();
        if (dropped > 0) {
            LOG.info("Discarded {} unexecuted command(s) on stop", dropped);
        }
        LOG.info("EngineLoop stopped after {} ticks ({} overruns)", ticks.get(), overruns.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return engine.isAutoStart();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    private void runLoop() {
        long intervalNanos = tickInterval.toNanos();
        long next = System.nanoTime();
        while (running) {
            long started = System.nanoTime();
            try {
                tickOnce(clock.instant());
            } catch (RuntimeException e) {
                LOG.error("Engine tick failed", e);
            }
            metrics.recordTick(System.nanoTime() - started);

            next += intervalNanos;
            long remaining = next - System.nanoTime();
            if (remaining <= 0) {
                overruns.incrementAndGet();
                metrics.incrementOverrun();
                LOG.debug("Tick overran interval by {} ms", TimeUtils.nanosToMillis(-remaining));
                next = System.nanoTime();
                continue;
            }
            pause(remaining);
        }
    }

    private void pause(long nanos) {
        synchronized (sleepMonitor) {
            if (!running) {
                return;
            }
            try {
                TimeUnit.NANOSECONDS.timedWait(sleepMonitor, nanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
            }
        }
    }

    // ---------------------------------------------------------------- commands

    @Override
    public boolean submit(EngineCommand command) {
        Objects.requireNonNull(command, "command");
        if (!accepting) {
            LOG.debug("Engine not running; rejecting {}", command.type());
            return false;
        }
        if (pending.incrementAndGet() > MAX_PENDING_COMMANDS) {
            pending.decrementAndGet();
            LOG.warn("Command queue full; rejecting {}", command.type());
            return false;
        }
        commands.offer(command);
        return true;
    }

    int pendingCommands() {
        return pending.get();
    }

    // Package-private for tests: accept commands without starting the tick thread
    void acceptCommands() {
        accepting = true;
    }

    private int discardPendingCommands() {
        int dropped = 0;
        while (commands.poll() != null) {
            pending.decrementAndGet();
            dropped++;
        }
        return dropped;
    }

    private void drainCommands() {
        EngineCommand command;
        while ((command = commands.poll()) != null) {
            pending.decrementAndGet();
            try {
                execute(command);
            } catch (RuntimeException e) {
                LOG.warn("Command {} from {} failed: {}", command.type(), command.source(), e.toString());
            }
        }
    }

    private void execute(EngineCommand command) {
        switch (command.type()) {
            case MANUAL_DEATH -> {
                boolean boss = state.snapshot().bossMode();
                boolean sent = boss ? sync.reportBossDeath() : sync.reportDeath();
                metrics.incrementDeath(boss ? "boss" : "normal", command.source());
                LOG.info("Manual {} death ({})", boss ? "boss" : "normal", sent ? "sent" : "not sent");
            }
            case TOGGLE_BOSS -> {
                if (state.snapshot().bossMode()) {
                    sync.bossCancel();
                } else {
                    sync.bossStart();
                }
            }
            case TOGGLE_DETECTION -> {
                boolean enabled = !state.get(SessionField.DETECTION_ENABLED);
                state.set(SessionField.DETECTION_ENABLED, enabled);
                LOG.info("Detection {}", enabled ? "ON" : "OFF");
            }
            case TOGGLE_DISPLAY_MODE -> publisher.publishEvent(new DisplayModeToggledEvent(Instant.now()));
            case START_TIMER -> sync.startTimer();
            case STOP_TIMER -> sync.stopTimer();
            case RESET_TIMER -> sync.resetTimer();
            case BOSS_START -> sync.bossStart();
            case BOSS_PAUSE -> sync.bossPause();
            case BOSS_RESUME -> sync.bossResume();
            case BOSS_VICTORY -> sync.bossVictory(command.text());
            case BOSS_CANCEL -> sync.bossCancel();
            case SET_ELAPSED -> sync.setElapsed(command.value());
            case SET_DEATHS -> sync.setDeaths(Math.toIntExact(command.value()));
            case MILESTONE_ADD -> sync.addMilestone(command.milestone().name(), command.milestone().icon());
            case MILESTONE_EDIT -> {
                Milestone m = command.milestone();
                sync.editMilestone(m.id(), m.name(), m.icon(), m.timestamp());
            }
            case MILESTONE_DELETE -> sync.deleteMilestone(command.text());
            case STATS_ADD -> sync.addStats(command.stats());
            case STATS_EDIT -> sync.editStats(command.text(), command.stats());
            case STATS_DELETE -> sync.deleteStats(command.text());
            case RELOAD_TEMPLATE -> {
                ReferenceTemplate template = templates.load(command.text());
                gate.replaceTemplate(template);
            }
        }
    }

    // ---------------------------------------------------------------- tick

    // Package-private for tests
    void tickOnce(Instant now) {
        drainCommands();
        refreshDisplayElapsed(now);

        Optional<Frame> frame = grabFrame();
        if (frame.isEmpty()) {
            metrics.incrementCaptureMiss();
            ticks.incrementAndGet();
            return;
        }
        gate.evaluate(frame.get(), now).ifPresent(this::dispatch);
        ticks.incrementAndGet();
    }

    private void dispatch(DeathEvent event) {
        detections.incrementAndGet();
        boolean sent = event.boss() ? sync.reportBossDeath() : sync.reportDeath();
        metrics.incrementDeath(event.boss() ? "boss" : "normal", "detector");
        publisher.publishEvent(new DeathDetectedEvent(event.at(), event.boss(), event.confidence(), sent));
    }

    private Optional<Frame> grabFrame() {
        if (!frames.isAvailable()) {
            return Optional.empty();
        }
        Optional<Frame> frame;
        try {
            DetectionProperties.Region r = detection.getRegion();
            frame = r == null ? frames.grab() : frames.grabRegion(r.x(), r.y(), r.width(), r.height());
        } catch (RuntimeException e) {
            LOG.debug("Frame grab failed: {}", e.toString());
            frame = Optional.empty();
        }
        trackCaptureAvailability(frame.isPresent());
        return frame;
    }

    private void trackCaptureAvailability(boolean gotFrame) {
        if (gotFrame == captureAvailable) {
            return;
        }
        captureAvailable = gotFrame;
        if (gotFrame) {
            LOG.info("Screen capture recovered");
        } else {
            publisher.publishEvent(new CaptureErrorEvent("no frame from capture source", Instant.now()));
        }
    }

    private void refreshDisplayElapsed(Instant now) {
        SessionSnapshot snap = state.snapshot();
        long display = snap.elapsedMs();
        Instant syncedAt = state.elapsedSyncedAt();
        if (snap.running() && syncedAt != null && now.isAfter(syncedAt)) {
            display += Duration.between(syncedAt, now).toMillis();
        }
        state.set(SessionField.DISPLAY_ELAPSED_MS, display);
    }

    // ---------------------------------------------------------------- reporting

    @Scheduled(fixedRate = 60_000, initialDelay = 60_000)
    void logSummary() {
        if (!running) {
            return;
        }
        SessionSnapshot snap = state.snapshot();
        LOG.info("Engine summary: ticks={}, overruns={}, detections={}, connection={}, deaths={}, time={}, detection={}",
                ticks.get(), overruns.get(), detections.get(), sync.connectionState(), snap.deathCount(),
                TimeUtils.formatClock(snap.displayElapsedMs()), snap.detectionEnabled() ? "on" : "off");
    }

    public long tickCount() {
        return ticks.get();
    }

    public long overrunCount() {
        return overruns.get();
    }

    public long detectionCount() {
        return detections.get();
    }

    public Duration tickInterval() {
        return tickInterval;
    }
}
