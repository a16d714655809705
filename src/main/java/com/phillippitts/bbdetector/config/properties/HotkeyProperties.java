package com.phillippitts.bbdetector.config.properties;

import com.phillippitts.bbdetector.service.hotkey.HotkeyAction;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed properties for global hotkeys.
 *
 * Bindings map an action name to a combination, e.g.
 * {@code hotkey.bindings.manual-death=ctrl+shift+d}. Actions that are not configured keep
 * their default combination. Values are validated on startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "hotkey")
public class HotkeyProperties {

    /** Register the global key hook at all. */
    private final boolean enabled;

    /** Action name → combination. Always contains every action. */
    private final Map<String, String> bindings;

    /** Reserved OS shortcuts to flag as conflicts (e.g., CONTROL+TAB, ALT+F4). */
    private final List<String> reserved;

    @ConstructorBinding
    public HotkeyProperties(Boolean enabled,
                            Map<String, String> bindings,
                            List<String> reserved) {
        this.enabled = enabled == null || enabled;
        Map<String, String> merged = new LinkedHashMap<>();
        for (HotkeyAction action : HotkeyAction.values()) {
            merged.put(action.key(), action.defaultCombination());
        }
        if (bindings != null) {
            merged.putAll(bindings);
        }
        this.bindings = Collections.unmodifiableMap(merged);
        // Provide sensible defaults if not supplied
        this.reserved = (reserved == null || reserved.isEmpty())
                ? List.of("CONTROL+TAB", "CONTROL+Q", "CONTROL+W", "ALT+F4", "ALT+TAB")
                : List.copyOf(reserved);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Map<String, String> getBindings() {
        return bindings;
    }

    public List<String> getReserved() {
        return reserved;
    }
}
