package com.phillippitts.bbdetector.service.state;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single source of truth for the live session: counters, timer, boss-fight flags and
 * connection/edit flags. Every other component reads from here and writes through here.
 *
 * <p><b>Thread Safety:</b> reads are lock-free against an immutable {@link SessionSnapshot}
 * published through a volatile reference, so a reader observes either the state before or after
 * a mutation, never a half-applied one. Writes ({@link #set}, {@link #merge}) are serialized by a
 * single monitor, which also covers listener notification; the order of writes and the order of
 * notifications are therefore the same for every observer. A listener that writes from inside its
 * callback has its change queued and notified after every field of the outer write.
 *
 * <p><b>Notification:</b> each field whose value actually changes produces exactly one
 * {@link StateChangeListener} callback per listener, in subscription order. Writing a value equal
 * to the current one is a no-op. A throwing listener is reported to the
 * {@link ListenerErrorHandler} and does not stop the remaining listeners.
 *
 * <p><b>Invariants kept on every write:</b>
 * <ul>
 *   <li>{@code canEdit} is forced to {@code false} whenever {@code connected} is {@code false}</li>
 *   <li>{@code bossDeathCount} resets to 0 when boss mode turns on, unless the same write
 *       carries an explicit boss death count</li>
 * </ul>
 */
public class SharedState {

    private static final Logger LOG = LogManager.getLogger(SharedState.class);

    private final Object writeLock = new Object();
    private final List<StateChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final ListenerErrorHandler errorHandler;
    private final Clock clock;

    // Guarded by writeLock
    private final Deque<Notification> pendingNotifications = new ArrayDeque<>();
    private boolean notifying;

    private volatile SessionSnapshot current = SessionSnapshot.defaults();
    private volatile Instant elapsedSyncedAt;

    public SharedState() {
        this(Clock.systemUTC(), SharedState::logListenerError);
    }

    public SharedState(Clock clock, ListenerErrorHandler errorHandler) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    }

    public <T> T get(SessionField<T> field) {
        return current.get(Objects.requireNonNull(field, "field"));
    }

    /**
     * Untyped read by field name.
     *
     * @throws com.phillippitts.bbdetector.exception.UnknownFieldException for names outside the field set
     */
    public Object get(String fieldName) {
        return current.get(SessionField.require(fieldName));
    }

    public SessionSnapshot snapshot() {
        return current;
    }

    public <T> void set(SessionField<T> field, T value) {
        Map<SessionField<?>, Object> change = new LinkedHashMap<>();
        change.put(Objects.requireNonNull(field, "field"), value);
        merge(change);
    }

    /**
     * Untyped write by field name.
     *
     * @throws com.phillippitts.bbdetector.exception.UnknownFieldException for names outside the field set
     * @throws IllegalArgumentException if the value has the wrong type for the field
     */
    public void set(String fieldName, Object value) {
        Map<SessionField<?>, Object> change = new LinkedHashMap<>();
        change.put(SessionField.require(fieldName), value);
        merge(change);
    }

    /**
     * Applies all given values as one atomic write.
     *
     * @throws IllegalArgumentException if any value fails validation (nothing is applied)
     */
    public void merge(Map<? extends SessionField<?>, ?> values) {
        Objects.requireNonNull(values, "values");
        Map<SessionField<?>, Object> validated = new LinkedHashMap<>();
        values.forEach((field, value) -> validated.put(field, field.coerce(value)));
        if (validated.isEmpty()) {
            return;
        }

        synchronized (writeLock) {
            SessionSnapshot before = current;
            enforceInvariants(before, validated);
            SessionSnapshot after = before.with(validated);
            if (validated.containsKey(SessionField.ELAPSED_MS)) {
                elapsedSyncedAt = clock.instant();
            }

            List<SessionField<?>> changed = new ArrayList<>();
            for (SessionField<?> f : SessionField.values()) {
                if (!Objects.equals(before.get(f), after.get(f))) {
                    changed.add(f);
                }
            }
            if (changed.isEmpty()) {
                return;
            }
            current = after;
            for (SessionField<?> f : changed) {
                pendingNotifications.add(new Notification(f, after.get(f)));
            }
            if (notifying) {
                return; // reentrant write from a listener; the outer loop delivers it
            }
            notifying = true;
            try {
                Notification n;
                while ((n = pendingNotifications.poll()) != null) {
                    notifyListeners(n.field(), n.value());
                }
            } finally {
                notifying = false;
                pendingNotifications.clear();
            }
        }
    }

    private record Notification(SessionField<?> field, Object value) { }

    private static void enforceInvariants(SessionSnapshot before, Map<SessionField<?>, Object> changes) {
        boolean bossBefore = before.bossMode();
        Object bossAfter = changes.getOrDefault(SessionField.BOSS_MODE, bossBefore);
        if (!bossBefore && Boolean.TRUE.equals(bossAfter)
                && !changes.containsKey(SessionField.BOSS_DEATH_COUNT)) {
            changes.put(SessionField.BOSS_DEATH_COUNT, 0);
        }
        Object connectedAfter = changes.getOrDefault(SessionField.CONNECTED, before.connected());
        if (Boolean.FALSE.equals(connectedAfter)) {
            changes.put(SessionField.CAN_EDIT, false);
        }
    }

    private void notifyListeners(SessionField<?> field, Object value) {
        for (StateChangeListener l : listeners) {
            try {
                l.onStateChanged(field, value);
            } catch (RuntimeException e) {
                errorHandler.onListenerError(l, field, e);
            }
        }
    }

    public void subscribe(StateChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void unsubscribe(StateChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Wall-clock time of the last write that carried {@code elapsedMs}, even when the value
     * itself did not change. Base point for display extrapolation; null until the first sync.
     */
    public Instant elapsedSyncedAt() {
        return elapsedSyncedAt;
    }

    private static void logListenerError(StateChangeListener listener, SessionField<?> field, RuntimeException e) {
        LOG.warn("State listener {} failed for field {}: {}", listener, field, e.toString());
    }
}
