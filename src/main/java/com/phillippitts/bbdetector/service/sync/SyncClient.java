package com.phillippitts.bbdetector.service.sync;

import com.phillippitts.bbdetector.config.properties.SyncProperties;
import com.phillippitts.bbdetector.exception.SyncProtocolException;
import com.phillippitts.bbdetector.service.metrics.SessionMetrics;
import com.phillippitts.bbdetector.service.state.SessionField;
import com.phillippitts.bbdetector.service.state.SharedState;
import com.phillippitts.bbdetector.service.sync.event.AuthenticationResultEvent;
import com.phillippitts.bbdetector.service.sync.event.SyncConnectedEvent;
import com.phillippitts.bbdetector.service.sync.event.SyncDisconnectedEvent;
import com.phillippitts.bbdetector.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single logical connection to the session service.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * DISCONNECTED → CONNECTING     (connect() or scheduled retry)
 * CONNECTING   → CONNECTED      (handshake done)
 * CONNECTING   → DISCONNECTED   (handshake failed, retry scheduled)
 * CONNECTED    → AUTHENTICATED  (snapshot grants edit rights, or bb-auth-result success)
 * any          → DISCONNECTED   (close, error or failed send; retry unless disconnect() was called)
 * </pre>
 *
 * <p>Every inbound snapshot is merged into {@link SharedState}, authenticated or not. The one
 * automatic {@code bb-auth} per connection is sent when a snapshot withholds edit rights and a
 * password is configured. Outbound commands are sent only while {@link ConnectionState#AUTHENTICATED};
 * otherwise they are dropped, never queued.
 *
 * <p><b>Thread Safety:</b> connection bookkeeping is guarded by a {@link ReentrantLock}.
 * The {@code connected}/{@code canEdit} writes to {@link SharedState} happen under the same lock
 * as the generation check they depend on; event publication and transport calls happen outside it.
 * Each connection attempt carries a generation number; callbacks from a superseded attempt are
 * ignored, so a close that races with a reconnect cannot tear down the new connection.
 */
@Service
public class SyncClient implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(SyncClient.class);

    /** Stopped after the engine loop and the hotkey router. */
    public static final int PHASE = 100;

    static final int NORMAL_CLOSE = 1000;
    static final int GOING_AWAY = 1001;
    private static final int MAX_LOGGED_PAYLOAD = 120;

    private final SyncTransport transport;
    private final SharedState state;
    private final SyncProperties props;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final SessionMetrics metrics;

    private final Lock lock = new ReentrantLock();
    private ConnectionState connectionState = ConnectionState.DISCONNECTED;
    private SyncConnection connection;
    private long generation;
    private boolean authAttempted;
    private boolean authGranted;
    private boolean stopRequested = true;
    private int failedAttempts;
    private ScheduledFuture<?> pendingReconnect;
    private String profile;
    private String password;

    private volatile boolean running;

    public SyncClient(SyncTransport transport,
                      SharedState state,
                      SyncProperties props,
                      @Qualifier("syncScheduler") TaskScheduler scheduler,
                      ApplicationEventPublisher publisher,
                      SessionMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.state = Objects.requireNonNull(state, "state");
        this.props = Objects.requireNonNull(props, "props");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.profile = props.getProfile();
        this.password = props.getPassword();
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        if (props.isAutoConnect()) {
            connect();
        } else {
            LOG.info("Sync auto-connect disabled; waiting for an explicit connect");
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        disconnect();
        running = false;
        LOG.info("SyncClient stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    // ---------------------------------------------------------------- connection control

    /**
     * Opens the connection if none is open or opening. A pending retry is superseded.
     */
    public void connect() {
        lock.lock();
        try {
            stopRequested = false;
            if (connectionState != ConnectionState.DISCONNECTED) {
                return;
            }
            cancelPendingReconnect();
        } finally {
            lock.unlock();
        }
        openConnection();
    }

    /**
     * Closes the connection and cancels any pending retry. Terminal until the next
     * {@link #connect()}. Idempotent.
     */
    public void disconnect() {
        SyncConnection toClose;
        boolean wasActive;
        String currentProfile;
        lock.lock();
        try {
            stopRequested = true;
            cancelPendingReconnect();
            toClose = connection;
            wasActive = connectionState != ConnectionState.DISCONNECTED;
            connection = null;
            connectionState = ConnectionState.DISCONNECTED;
            authAttempted = false;
            authGranted = false;
            failedAttempts = 0;
            generation++;
            currentProfile = profile;
            markDisconnected();
        } finally {
            lock.unlock();
        }
        if (toClose != null) {
            closeQuietly(toClose, NORMAL_CLOSE, "Client disconnect");
        }
        if (wasActive) {
            LOG.info("Disconnected from session service");
            publisher.publishEvent(new SyncDisconnectedEvent(currentProfile, "client disconnect", false, Instant.now()));
        }
    }

    /**
     * Retargets the connection to another profile: disconnects, swaps credentials, reconnects.
     * The new connection gets its own single authentication attempt.
     */
    public void switchProfile(String newProfile, String newPassword) {
        Objects.requireNonNull(newProfile, "newProfile");
        disconnect();
        lock.lock();
        try {
            profile = newProfile.trim();
            password = newPassword == null ? "" : newPassword;
        } finally {
            lock.unlock();
        }
        LOG.info("Switching to profile '{}' (password {})", newProfile.trim(), LogSanitizer.mask(newPassword));
        connect();
    }

    private void openConnection() {
        long attempt;
        URI target;
        lock.lock();
        try {
            attempt = ++generation;
            connectionState = ConnectionState.CONNECTING;
            connection = null;
            authAttempted = false;
            authGranted = false;
            target = targetUri();
        } finally {
            lock.unlock();
        }
        LOG.info("Connecting to {} (profile '{}')", target.getHost(), currentProfile());
        SyncConnection opened;
        try {
            opened = transport.open(target, new AttemptListener(attempt));
        } catch (RuntimeException e) {
            handleConnectionLost(attempt, "open failed: " + e.getClass().getSimpleName());
            return;
        }
        lock.lock();
        try {
            if (attempt == generation && connection == null && connectionState != ConnectionState.DISCONNECTED) {
                connection = opened;
            }
        } finally {
            lock.unlock();
        }
    }

    private URI targetUri() {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(props.getUrl());
        props.getRoute().forEach(builder::queryParam);
        if (profile != null && !profile.isBlank()) {
            builder.queryParam("profile", profile);
        }
        return builder.encode().build().toUri();
    }

    // Must hold lock
    private void scheduleReconnect() {
        Duration delay = backoffDelay(failedAttempts);
        failedAttempts++;
        pendingReconnect = scheduler.schedule(this::reconnect, Instant.now().plus(delay));
        metrics.incrementReconnect();
        LOG.info("Reconnecting in {} ms", delay.toMillis());
    }

    Duration backoffDelay(int failures) {
        Duration base = props.getReconnectDelay();
        Duration max = props.getMaxReconnectDelay();
        Duration delay = base;
        for (int i = 0; i < failures && delay.compareTo(max) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private void reconnect() {
        lock.lock();
        try {
            pendingReconnect = null;
            if (stopRequested || connectionState != ConnectionState.DISCONNECTED) {
                return;
            }
        } finally {
            lock.unlock();
        }
        openConnection();
    }

    // Must hold lock
    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    // ---------------------------------------------------------------- inbound

    private void handleOpen(long attempt, SyncConnection opened) {
        String currentProfile;
        lock.lock();
        try {
            if (attempt != generation) {
                closeQuietly(opened, NORMAL_CLOSE, "Superseded");
                return;
            }
            connection = opened;
            connectionState = ConnectionState.CONNECTED;
            failedAttempts = 0;
            currentProfile = profile;
            state.set(SessionField.CONNECTED, true);
        } finally {
            lock.unlock();
        }
        LOG.info("Connected to session service");
        publisher.publishEvent(new SyncConnectedEvent(currentProfile, Instant.now()));
    }

    private void handleMessage(long attempt, String text) {
        if (!isCurrent(attempt)) {
            return;
        }
        SyncMessages.Inbound message;
        try {
            message = SyncMessages.decode(text);
        } catch (SyncProtocolException e) {
            LOG.warn("Discarding malformed message ({}): {}", e.getMessage(),
                    LogSanitizer.truncate(text, MAX_LOGGED_PAYLOAD));
            return;
        }
        if (message instanceof SyncMessages.StateSnapshot snapshot) {
            handleSnapshot(attempt, snapshot);
        } else if (message instanceof SyncMessages.AuthResult result) {
            handleAuthResult(attempt, result);
        } else if (message instanceof SyncMessages.ServerError error) {
            LOG.warn("Server error: {} (code {})", LogSanitizer.truncate(error.error(), MAX_LOGGED_PAYLOAD), error.code());
        } else if (message instanceof SyncMessages.Unhandled unhandled) {
            LOG.debug("Ignoring message type {}", unhandled.type());
        }
    }

    private void handleSnapshot(long attempt, SyncMessages.StateSnapshot snapshot) {
        boolean grantsEdit = snapshot.canEdit();
        boolean keepEdit = false;
        String authPayload = null;
        SyncConnection conn;
        lock.lock();
        try {
            if (attempt != generation) {
                return;
            }
            conn = connection;
            if (grantsEdit) {
                connectionState = ConnectionState.AUTHENTICATED;
            } else if (authGranted) {
                keepEdit = true;
            } else {
                if (connectionState == ConnectionState.AUTHENTICATED) {
                    connectionState = ConnectionState.CONNECTED;
                }
                if (!authAttempted && !password.isEmpty()) {
                    authAttempted = true;
                    authPayload = SyncMessages.auth(password);
                }
            }
            Map<SessionField<?>, Object> values = new LinkedHashMap<>(snapshot.values());
            values.put(SessionField.CONNECTED, true);
            if (keepEdit) {
                values.put(SessionField.CAN_EDIT, true);
            }
            state.merge(values);
        } finally {
            lock.unlock();
        }

        if (authPayload != null && conn != null) {
            LOG.info("Snapshot without edit rights; sending authentication");
            if (!trySend(conn, authPayload)) {
                handleSendFailure(attempt, conn, SyncMessages.AUTH);
            }
        }
    }

    private void handleAuthResult(long attempt, SyncMessages.AuthResult result) {
        String currentProfile;
        lock.lock();
        try {
            if (attempt != generation) {
                return;
            }
            authGranted = result.success();
            connectionState = result.success() ? ConnectionState.AUTHENTICATED : ConnectionState.CONNECTED;
            currentProfile = profile;
            state.set(SessionField.CAN_EDIT, result.success());
        } finally {
            lock.unlock();
        }
        if (result.success()) {
            LOG.info("Authenticated for profile '{}'", currentProfile);
        } else {
            LOG.warn("Authentication failed for profile '{}': {}", currentProfile,
                    LogSanitizer.truncate(result.error(), MAX_LOGGED_PAYLOAD));
        }
        publisher.publishEvent(new AuthenticationResultEvent(currentProfile, result.success(), result.error(), Instant.now()));
    }

    private void handleConnectionLost(long attempt, String reason) {
        boolean retry;
        String currentProfile;
        lock.lock();
        try {
            if (attempt != generation) {
                return;
            }
            generation++;
            connection = null;
            connectionState = ConnectionState.DISCONNECTED;
            authAttempted = false;
            authGranted = false;
            retry = !stopRequested;
            if (retry) {
                scheduleReconnect();
            }
            currentProfile = profile;
            markDisconnected();
        } finally {
            lock.unlock();
        }
        LOG.warn("Connection lost: {}", reason);
        publisher.publishEvent(new SyncDisconnectedEvent(currentProfile, reason, retry, Instant.now()));
    }

    // Must hold lock, so a superseded attempt can never write connection flags after this one
    private void markDisconnected() {
        Map<SessionField<?>, Object> values = new LinkedHashMap<>();
        values.put(SessionField.CONNECTED, false);
        values.put(SessionField.CAN_EDIT, false);
        state.merge(values);
    }

    private boolean isCurrent(long attempt) {
        lock.lock();
        try {
            return attempt == generation;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- outbound

    public boolean reportDeath() {
        return sendCommand(SyncMessages.DEATH, SyncMessages.command(SyncMessages.DEATH));
    }

    public boolean reportBossDeath() {
        return sendCommand(SyncMessages.BOSS_DEATH, SyncMessages.command(SyncMessages.BOSS_DEATH));
    }

    public boolean bossStart() {
        return sendCommand(SyncMessages.BOSS_START, SyncMessages.command(SyncMessages.BOSS_START));
    }

    public boolean bossPause() {
        return sendCommand(SyncMessages.BOSS_PAUSE, SyncMessages.command(SyncMessages.BOSS_PAUSE));
    }

    public boolean bossResume() {
        return sendCommand(SyncMessages.BOSS_RESUME, SyncMessages.command(SyncMessages.BOSS_RESUME));
    }

    public boolean bossVictory(String name) {
        return sendCommand(SyncMessages.BOSS_VICTORY, SyncMessages.bossVictory(name));
    }

    public boolean bossCancel() {
        return sendCommand(SyncMessages.BOSS_CANCEL, SyncMessages.command(SyncMessages.BOSS_CANCEL));
    }

    public boolean startTimer() {
        return sendCommand(SyncMessages.START, SyncMessages.command(SyncMessages.START));
    }

    public boolean stopTimer() {
        return sendCommand(SyncMessages.STOP, SyncMessages.command(SyncMessages.STOP));
    }

    public boolean resetTimer() {
        return sendCommand(SyncMessages.RESET, SyncMessages.command(SyncMessages.RESET));
    }

    public boolean setElapsed(long elapsedMs) {
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs must be >= 0, got " + elapsedMs);
        }
        return sendCommand(SyncMessages.SET_TIME, SyncMessages.setTime(elapsedMs));
    }

    public boolean setDeaths(int deaths) {
        if (deaths < 0) {
            throw new IllegalArgumentException("deaths must be >= 0, got " + deaths);
        }
        return sendCommand(SyncMessages.SET_DEATHS, SyncMessages.setDeaths(deaths));
    }

    public boolean addMilestone(String name, String icon) {
        requireText(name, "name");
        return sendCommand(SyncMessages.MILESTONE_ADD, SyncMessages.milestoneAdd(name, icon));
    }

    public boolean editMilestone(String id, String name, String icon, Long timestamp) {
        requireText(id, "id");
        requireText(name, "name");
        return sendCommand(SyncMessages.MILESTONE_EDIT, SyncMessages.milestoneEdit(id, name, icon, timestamp));
    }

    public boolean deleteMilestone(String id) {
        requireText(id, "id");
        return sendCommand(SyncMessages.MILESTONE_DELETE, SyncMessages.milestoneDelete(id));
    }

    public boolean addStats(CharacterStats stats) {
        Objects.requireNonNull(stats, "stats");
        return sendCommand(SyncMessages.STATS_ADD, SyncMessages.statsAdd(stats));
    }

    public boolean editStats(String id, CharacterStats stats) {
        requireText(id, "id");
        Objects.requireNonNull(stats, "stats");
        return sendCommand(SyncMessages.STATS_EDIT, SyncMessages.statsEdit(id, stats));
    }

    public boolean deleteStats(String id) {
        requireText(id, "id");
        return sendCommand(SyncMessages.STATS_DELETE, SyncMessages.statsDelete(id));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    /**
     * Sends one command if authenticated.
     *
     * @return true if the frame was handed to the transport
     */
    private boolean sendCommand(String type, String payload) {
        SyncConnection conn;
        long attempt;
        lock.lock();
        try {
            if (connectionState != ConnectionState.AUTHENTICATED || connection == null) {
                conn = null;
                attempt = -1;
            } else {
                conn = connection;
                attempt = generation;
            }
        } finally {
            lock.unlock();
        }
        if (conn == null) {
            LOG.debug("Dropping {}: not authenticated", type);
            metrics.incrementCommand(type, "dropped");
            return false;
        }
        if (!trySend(conn, payload)) {
            metrics.incrementCommand(type, "failed");
            handleSendFailure(attempt, conn, type);
            return false;
        }
        metrics.incrementCommand(type, "sent");
        LOG.debug("Sent {}", type);
        return true;
    }

    private static boolean trySend(SyncConnection conn, String payload) {
        try {
            return conn.send(payload);
        } catch (RuntimeException e) {
            LOG.debug("Transport send threw", e);
            return false;
        }
    }

    private void handleSendFailure(long attempt, SyncConnection conn, String type) {
        handleConnectionLost(attempt, "send failed for " + type);
        closeQuietly(conn, GOING_AWAY, "Send failed");
    }

    private static void closeQuietly(SyncConnection conn, int code, String reason) {
        try {
            conn.close(code, reason);
        } catch (RuntimeException e) {
            LOG.debug("Error closing connection", e);
        }
    }

    // ---------------------------------------------------------------- queries

    public ConnectionState connectionState() {
        lock.lock();
        try {
            return connectionState;
        } finally {
            lock.unlock();
        }
    }

    public boolean isAuthenticated() {
        return connectionState() == ConnectionState.AUTHENTICATED;
    }

    public String currentProfile() {
        lock.lock();
        try {
            return profile;
        } finally {
            lock.unlock();
        }
    }

    boolean hasPendingReconnect() {
        lock.lock();
        try {
            return pendingReconnect != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Transport callbacks for one connection attempt. Sets the {@code profile} logging context
     * on the transport thread.
     */
    private final class AttemptListener implements SyncTransportListener {

        private final long attempt;

        private AttemptListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onOpen(SyncConnection opened) {
            try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("profile", currentProfile())) {
                handleOpen(attempt, opened);
            }
        }

        @Override
        public void onMessage(SyncConnection source, String text) {
            try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("profile", currentProfile())) {
                handleMessage(attempt, text);
            }
        }

        @Override
        public void onClosed(SyncConnection source, int code, String reason) {
            try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("profile", currentProfile())) {
                handleConnectionLost(attempt, "closed (" + code + ")");
            }
        }

        @Override
        public void onFailure(SyncConnection source, Throwable error) {
            try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("profile", currentProfile())) {
                handleConnectionLost(attempt, "failure: " + error.getClass().getSimpleName());
            }
        }
    }
}
