package com.phillippitts.bbdetector.service.hotkey;

import java.util.Set;

/**
 * Normalized keyboard event used by the Hotkey subsystem.
 * Key and modifier names are canonicalized through {@link KeyNameMapper}, so
 * "Ctrl", "Left Control" and "Command" all arrive as {@code CONTROL}.
 *
 * @param modifiers modifiers the OS reports as held at the time of the event; may be empty
 *                  on platforms that do not report them
 */
public record NormalizedKeyEvent(Type type, String key, Set<String> modifiers, long whenMillis) {

    public enum Type { PRESSED, RELEASED }

    public NormalizedKeyEvent {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        key = KeyNameMapper.canonical(key);
        modifiers = modifiers == null ? Set.of()
                : Set.copyOf(modifiers.stream().map(KeyNameMapper::canonical).toList());
    }

    public static NormalizedKeyEvent pressed(String key, String... modifiers) {
        return new NormalizedKeyEvent(Type.PRESSED, key, Set.of(modifiers), System.currentTimeMillis());
    }

    public static NormalizedKeyEvent released(String key) {
        return new NormalizedKeyEvent(Type.RELEASED, key, Set.of(), System.currentTimeMillis());
    }
}
