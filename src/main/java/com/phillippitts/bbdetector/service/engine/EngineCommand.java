package com.phillippitts.bbdetector.service.engine;

import com.phillippitts.bbdetector.service.sync.CharacterStats;
import com.phillippitts.bbdetector.service.sync.Milestone;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A request executed on the engine thread at the start of the next tick.
 *
 * @param text  victory name for {@link Type#BOSS_VICTORY}, template location for
 *              {@link Type#RELOAD_TEMPLATE}, target id for deletes and {@link Type#STATS_EDIT};
 *              otherwise null
 * @param value numeric argument for {@link Type#SET_ELAPSED} and {@link Type#SET_DEATHS}, otherwise 0
 * @param milestone fields for {@link Type#MILESTONE_ADD} and {@link Type#MILESTONE_EDIT}
 * @param stats attributes for {@link Type#STATS_ADD} and {@link Type#STATS_EDIT}
 * @param source who asked (hotkey, api); used for logging and metrics only
 */
public record EngineCommand(Type type, String text, long value, Milestone milestone, CharacterStats stats,
                            String source) {

    public enum Type {
        /** Death or boss death, depending on boss mode at dispatch time. */
        MANUAL_DEATH,
        /** Cancel the boss fight if one is active, otherwise start one. */
        TOGGLE_BOSS,
        TOGGLE_DETECTION,
        /** Local presentation only; published as an event for the renderer. */
        TOGGLE_DISPLAY_MODE,
        START_TIMER,
        STOP_TIMER,
        RESET_TIMER,
        BOSS_START,
        BOSS_PAUSE,
        BOSS_RESUME,
        BOSS_VICTORY,
        BOSS_CANCEL,
        SET_ELAPSED,
        SET_DEATHS,
        MILESTONE_ADD,
        MILESTONE_EDIT,
        MILESTONE_DELETE,
        STATS_ADD,
        STATS_EDIT,
        STATS_DELETE,
        /** Swap the reference template and restart the detection window. */
        RELOAD_TEMPLATE;

        /** Kebab-case name used in configuration and URLs, e.g. {@code manual-death}. */
        public String wireName() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }

        public static Optional<Type> fromWireName(String name) {
            if (name == null) {
                return Optional.empty();
            }
            String n = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            return Arrays.stream(values()).filter(t -> t.name().equals(n)).findFirst();
        }
    }

    public EngineCommand {
        Objects.requireNonNull(type, "type");
        if (value < 0) {
            throw new IllegalArgumentException("value must be >= 0, got " + value);
        }
        source = source == null ? "unknown" : source;
    }

    public static EngineCommand of(Type type, String source) {
        return new EngineCommand(type, null, 0, null, null, source);
    }

    public static EngineCommand bossVictory(String name, String source) {
        return new EngineCommand(Type.BOSS_VICTORY, name == null ? "" : name, 0, null, null, source);
    }

    public static EngineCommand setElapsed(long elapsedMs, String source) {
        return new EngineCommand(Type.SET_ELAPSED, null, elapsedMs, null, null, source);
    }

    public static EngineCommand setDeaths(int deaths, String source) {
        return new EngineCommand(Type.SET_DEATHS, null, deaths, null, null, source);
    }

    public static EngineCommand addMilestone(String name, String icon, String source) {
        return new EngineCommand(Type.MILESTONE_ADD, null, 0, Milestone.of(name, icon), null, source);
    }

    public static EngineCommand editMilestone(Milestone milestone, String source) {
        return new EngineCommand(Type.MILESTONE_EDIT, null, 0, Objects.requireNonNull(milestone, "milestone"),
                null, source);
    }

    public static EngineCommand deleteMilestone(String id, String source) {
        return new EngineCommand(Type.MILESTONE_DELETE, id, 0, null, null, source);
    }

    public static EngineCommand addStats(CharacterStats stats, String source) {
        return new EngineCommand(Type.STATS_ADD, null, 0, null, Objects.requireNonNull(stats, "stats"), source);
    }

    public static EngineCommand editStats(String id, CharacterStats stats, String source) {
        return new EngineCommand(Type.STATS_EDIT, id, 0, null, Objects.requireNonNull(stats, "stats"), source);
    }

    public static EngineCommand deleteStats(String id, String source) {
        return new EngineCommand(Type.STATS_DELETE, id, 0, null, null, source);
    }

    public static EngineCommand reloadTemplate(String location, String source) {
        return new EngineCommand(Type.RELOAD_TEMPLATE, location, 0, null, null, source);
    }
}
