package com.phillippitts.bbdetector.service.hotkey;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Utility for canonicalizing key names and parsing combinations such as {@code ctrl+shift+d}.
 *
 * <p>Modifier aliases collapse to one identifier each: every control/command/meta spelling
 * becomes {@code CONTROL}, shift variants become {@code SHIFT}, alt/option variants become
 * {@code ALT}. Left and right keys are not distinguished.
 */
public final class KeyNameMapper {

    public static final String CONTROL = "CONTROL";
    public static final String SHIFT = "SHIFT";
    public static final String ALT = "ALT";

    private static final Set<String> MODIFIERS = Set.of(CONTROL, SHIFT, ALT);

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("CTRL", CONTROL),
            Map.entry("CONTROL", CONTROL),
            Map.entry("CMD", CONTROL),
            Map.entry("COMMAND", CONTROL),
            Map.entry("META", CONTROL),
            Map.entry("SUPER", CONTROL),
            Map.entry("WIN", CONTROL),
            Map.entry("WINDOWS", CONTROL),
            Map.entry("SHIFT", SHIFT),
            Map.entry("ALT", ALT),
            Map.entry("OPTION", ALT),
            Map.entry("OPT", ALT),
            Map.entry("ALT_GR", ALT),
            Map.entry("ALTGR", ALT),
            Map.entry("ESC", "ESCAPE"),
            Map.entry("RETURN", "ENTER"),
            Map.entry("DEL", "DELETE"));

    private static final Set<String> ALLOWED_KEYS;

    static {
        Set<String> keys = new HashSet<>(MODIFIERS);
        // Letters A..Z
        for (char c = 'A'; c <= 'Z'; c++) {
            keys.add(String.valueOf(c));
        }
        // Digits 0..9
        for (char c = '0'; c <= '9'; c++) {
            keys.add(String.valueOf(c));
        }
        // Function keys F1..F24
        IntStream.rangeClosed(1, 24).forEach(i -> keys.add("F" + i));
        // Specials
        keys.addAll(List.of("ESCAPE", "ENTER", "TAB", "SPACE", "BACKSPACE", "DELETE", "INSERT",
                "HOME", "END", "PAGE_UP", "PAGE_DOWN", "UP", "DOWN", "LEFT", "RIGHT"));
        ALLOWED_KEYS = Set.copyOf(keys);
    }

    private KeyNameMapper() {}

    /**
     * Canonicalize a key name: case-insensitive, spaces and dashes to underscores,
     * side prefixes/suffixes stripped from modifiers, aliases resolved.
     */
    public static String canonical(String keyText) {
        if (keyText == null || keyText.isBlank()) {
            return "UNKNOWN";
        }
        String k = keyText.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        String direct = ALIASES.get(k);
        if (direct != null) {
            return direct;
        }
        String stripped = stripSide(k);
        String modifier = ALIASES.get(stripped);
        if (modifier != null && MODIFIERS.contains(modifier)) {
            return modifier;
        }
        return k;
    }

    private static String stripSide(String k) {
        for (String prefix : List.of("LEFT_", "RIGHT_")) {
            if (k.startsWith(prefix)) {
                return k.substring(prefix.length());
            }
        }
        for (String suffix : List.of("_L", "_R")) {
            if (k.endsWith(suffix)) {
                return k.substring(0, k.length() - suffix.length());
            }
        }
        return k;
    }

    public static boolean isModifier(String key) {
        return MODIFIERS.contains(canonical(key));
    }

    public static boolean isValidKey(String key) {
        return ALLOWED_KEYS.contains(canonical(key));
    }

    /**
     * Parses {@code "ctrl+shift+d"} into its canonical key set.
     *
     * @throws IllegalArgumentException if the spec is blank, names an unknown key,
     *         or consists of modifiers only
     */
    public static Set<String> parseCombination(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Hotkey combination must not be blank");
        }
        Set<String> keys = new LinkedHashSet<>();
        for (String part : spec.split("\\+")) {
            String n = part.trim();
            if (n.isEmpty()) {
                continue;
            }
            String key = canonical(n);
            if (!ALLOWED_KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown key '" + n + "' in hotkey '" + spec + "'");
            }
            keys.add(key);
        }
        if (keys.isEmpty() || MODIFIERS.containsAll(keys)) {
            throw new IllegalArgumentException("Hotkey '" + spec + "' needs at least one non-modifier key");
        }
        return Set.copyOf(keys);
    }

    /** Renders a canonical key set as {@code CONTROL+SHIFT+D} (modifiers first). */
    public static String format(Set<String> combination) {
        StringBuilder sb = new StringBuilder();
        for (String m : List.of(CONTROL, SHIFT, ALT)) {
            if (combination.contains(m)) {
                sb.append(m).append('+');
            }
        }
        combination.stream().filter(k -> !MODIFIERS.contains(k)).sorted()
                .forEach(k -> sb.append(k).append('+'));
        return sb.length() == 0 ? "" : sb.substring(0, sb.length() - 1);
    }

    /**
     * Compare a configured combination against a reserved combo string like "CONTROL+TAB".
     * Unparseable reserved entries never match.
     */
    public static boolean matchesReserved(Set<String> combination, String reservedSpec) {
        if (reservedSpec == null || reservedSpec.isBlank()) {
            return false;
        }
        try {
            return parseCombination(reservedSpec).equals(combination);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
