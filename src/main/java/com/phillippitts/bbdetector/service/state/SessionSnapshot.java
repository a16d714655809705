package com.phillippitts.bbdetector.service.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable point-in-time copy of every session field.
 * Readers of {@link SharedState} always see one whole snapshot, never a partially applied merge.
 */
public final class SessionSnapshot {

    private final Map<SessionField<?>, Object> values;

    private SessionSnapshot(Map<SessionField<?>, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /** Snapshot holding every field's default value. */
    public static SessionSnapshot defaults() {
        Map<SessionField<?>, Object> values = new LinkedHashMap<>();
        for (SessionField<?> f : SessionField.values()) {
            values.put(f, f.defaultValue());
        }
        return new SessionSnapshot(values);
    }

    /** Returns a copy with the given (already validated) values replaced. */
    SessionSnapshot with(Map<SessionField<?>, Object> changes) {
        Map<SessionField<?>, Object> next = new LinkedHashMap<>(values);
        next.putAll(changes);
        return new SessionSnapshot(next);
    }

    public <T> T get(SessionField<T> field) {
        return field.type().cast(values.get(field));
    }

    public int deathCount() {
        return get(SessionField.DEATH_COUNT);
    }

    public long elapsedMs() {
        return get(SessionField.ELAPSED_MS);
    }

    public boolean running() {
        return get(SessionField.RUNNING);
    }

    public boolean bossMode() {
        return get(SessionField.BOSS_MODE);
    }

    public boolean bossPaused() {
        return get(SessionField.BOSS_PAUSED);
    }

    public int bossDeathCount() {
        return get(SessionField.BOSS_DEATH_COUNT);
    }

    public boolean connected() {
        return get(SessionField.CONNECTED);
    }

    public boolean canEdit() {
        return get(SessionField.CAN_EDIT);
    }

    public boolean detectionEnabled() {
        return get(SessionField.DETECTION_ENABLED);
    }

    public String profileId() {
        return get(SessionField.PROFILE_ID);
    }

    public String profileDisplayName() {
        return get(SessionField.PROFILE_DISPLAY_NAME);
    }

    public long displayElapsedMs() {
        return get(SessionField.DISPLAY_ELAPSED_MS);
    }

    /** Field name to value, in declaration order. */
    public Map<String, Object> asMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((f, v) -> out.put(f.name(), v));
        return out;
    }

    @Override
    public String toString() {
        return "SessionSnapshot" + asMap();
    }
}
