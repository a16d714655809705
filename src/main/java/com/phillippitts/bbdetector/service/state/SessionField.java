package com.phillippitts.bbdetector.service.state;

import com.phillippitts.bbdetector.exception.UnknownFieldException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of session fields held by {@link SharedState}, each with a fixed value type.
 *
 * <p>Fields are typed keys: {@code state.get(SessionField.DEATH_COUNT)} returns an
 * {@code Integer} without casts. Untyped callers (REST surface, wire mapping) resolve fields by
 * name through {@link #require(String)}, which rejects anything outside this set.
 *
 * <p>{@link #DISPLAY_ELAPSED_MS} is the only derived field: it is a local extrapolation for
 * display and is never treated as server truth.
 */
public final class SessionField<T> {

    public static final SessionField<Integer> DEATH_COUNT = counter("deathCount");
    public static final SessionField<Long> ELAPSED_MS = new SessionField<>("elapsedMs", Long.class, 0L, false, true);
    public static final SessionField<Boolean> RUNNING = flag("running", false);
    public static final SessionField<Boolean> BOSS_MODE = flag("bossMode", false);
    public static final SessionField<Boolean> BOSS_PAUSED = flag("bossPaused", false);
    public static final SessionField<Integer> BOSS_DEATH_COUNT = counter("bossDeathCount");
    public static final SessionField<Boolean> CONNECTED = flag("connected", false);
    public static final SessionField<Boolean> CAN_EDIT = flag("canEdit", false);
    public static final SessionField<Boolean> DETECTION_ENABLED = flag("detectionEnabled", true);
    public static final SessionField<String> PROFILE_ID = text("profileId");
    public static final SessionField<String> PROFILE_DISPLAY_NAME = text("profileDisplayName");
    public static final SessionField<Long> DISPLAY_ELAPSED_MS =
            new SessionField<>("displayElapsedMs", Long.class, 0L, true, true);

    private static final List<SessionField<?>> ALL = List.of(
            DEATH_COUNT, ELAPSED_MS, RUNNING, BOSS_MODE, BOSS_PAUSED, BOSS_DEATH_COUNT,
            CONNECTED, CAN_EDIT, DETECTION_ENABLED, PROFILE_ID, PROFILE_DISPLAY_NAME,
            DISPLAY_ELAPSED_MS);

    private static final Map<String, SessionField<?>> BY_NAME;

    static {
        Map<String, SessionField<?>> byName = new LinkedHashMap<>();
        for (SessionField<?> f : ALL) {
            byName.put(f.name, f);
        }
        BY_NAME = Map.copyOf(byName);
    }

    private final String name;
    private final Class<T> type;
    private final T defaultValue;
    private final boolean derived;
    private final boolean nonNegative;

    private SessionField(String name, Class<T> type, T defaultValue, boolean derived, boolean nonNegative) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.derived = derived;
        this.nonNegative = nonNegative;
    }

    private static SessionField<Integer> counter(String name) {
        return new SessionField<>(name, Integer.class, 0, false, true);
    }

    private static SessionField<Boolean> flag(String name, boolean defaultValue) {
        return new SessionField<>(name, Boolean.class, defaultValue, false, false);
    }

    private static SessionField<String> text(String name) {
        return new SessionField<>(name, String.class, "", false, false);
    }

    /** All fields in declaration order. */
    public static List<SessionField<?>> values() {
        return ALL;
    }

    public static Optional<SessionField<?>> byName(String name) {
        return Optional.ofNullable(name == null ? null : BY_NAME.get(name));
    }

    /**
     * Resolves a field by its name.
     *
     * @throws UnknownFieldException if no field has that name
     */
    public static SessionField<?> require(String name) {
        return byName(name).orElseThrow(() -> new UnknownFieldException(name));
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    public T defaultValue() {
        return defaultValue;
    }

    /** True for locally computed display values that never originate from the server. */
    public boolean isDerived() {
        return derived;
    }

    /**
     * Converts and validates a raw value for this field.
     * Integral numbers are widened or narrowed to the field type when they fit;
     * a null text value becomes the empty string.
     *
     * @throws IllegalArgumentException if the value has the wrong type or is out of range
     */
    public T coerce(Object value) {
        if (value == null) {
            if (type == String.class) {
                return type.cast("");
            }
            throw new IllegalArgumentException("Field " + name + " does not accept null");
        }
        Object converted = value;
        if (type == Integer.class && value instanceof Number n && isIntegral(n)) {
            long l = n.longValue();
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Field " + name + " out of range: " + value);
            }
            converted = (int) l;
        } else if (type == Long.class && value instanceof Number n && isIntegral(n)) {
            converted = n.longValue();
        }
        if (!type.isInstance(converted)) {
            throw new IllegalArgumentException("Field " + name + " expects " + type.getSimpleName()
                    + " but got " + value.getClass().getSimpleName());
        }
        if (nonNegative && ((Number) converted).longValue() < 0) {
            throw new IllegalArgumentException("Field " + name + " must be >= 0, got " + value);
        }
        return type.cast(converted);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof java.math.BigInteger;
    }

    @Override
    public String toString() {
        return name;
    }
}
