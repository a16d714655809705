package com.phillippitts.bbdetector.config.hotkey;

import com.phillippitts.bbdetector.config.properties.HotkeyProperties;
import com.phillippitts.bbdetector.service.hotkey.HotkeyAction;
import com.phillippitts.bbdetector.service.hotkey.KeyNameMapper;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Validates HotkeyProperties against the action set and key allow-list at startup to fail
 * fast with actionable messages.
 */
@Component
class HotkeyConfigurationValidator {

    private final HotkeyProperties props;

    HotkeyConfigurationValidator(HotkeyProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        Map<Set<String>, String> seen = new HashMap<>();
        props.getBindings().forEach((actionKey, combination) -> {
            if (HotkeyAction.fromKey(actionKey).isEmpty()) {
                throw new IllegalArgumentException("Invalid hotkey.bindings key: '" + actionKey
                        + "'. Allowed: manual-death, toggle-boss, toggle-detection, toggle-display-mode.");
            }
            Set<String> keys;
            try {
                keys = KeyNameMapper.parseCombination(combination);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid hotkey.bindings." + actionKey + ": " + e.getMessage()
                        + ". Use modifiers (ctrl, shift, alt) plus A-Z, 0-9, F1..F24 or a named key.", e);
            }
            String other = seen.putIfAbsent(keys, actionKey);
            if (other != null) {
                throw new IllegalArgumentException("hotkey.bindings." + actionKey + " and hotkey.bindings." + other
                        + " both use " + KeyNameMapper.format(keys));
            }
        });
        // Reserved list can hold anything; unparseable entries simply never match
    }
}
