package com.phillippitts.bbdetector.service.hotkey;

import com.phillippitts.bbdetector.service.engine.EngineCommand;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Actions that can be bound to a global key combination.
 */
public enum HotkeyAction {

    MANUAL_DEATH("ctrl+shift+d", EngineCommand.Type.MANUAL_DEATH),
    TOGGLE_BOSS("ctrl+shift+b", EngineCommand.Type.TOGGLE_BOSS),
    TOGGLE_DETECTION("ctrl+shift+p", EngineCommand.Type.TOGGLE_DETECTION),
    TOGGLE_DISPLAY_MODE("ctrl+shift+o", EngineCommand.Type.TOGGLE_DISPLAY_MODE);

    private final String defaultCombination;
    private final EngineCommand.Type commandType;

    HotkeyAction(String defaultCombination, EngineCommand.Type commandType) {
        this.defaultCombination = defaultCombination;
        this.commandType = commandType;
    }

    public String defaultCombination() {
        return defaultCombination;
    }

    public EngineCommand toCommand() {
        return EngineCommand.of(commandType, "hotkey");
    }

    /** Property-style name, e.g. {@code manual-death}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /** Accepts {@code manual-death}, {@code manual_death} or {@code MANUAL_DEATH}. */
    public static Optional<HotkeyAction> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String n = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values()).filter(a -> a.name().equals(n)).findFirst();
    }
}
