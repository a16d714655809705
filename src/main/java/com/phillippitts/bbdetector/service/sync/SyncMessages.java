package com.phillippitts.bbdetector.service.sync;

import com.phillippitts.bbdetector.exception.SyncProtocolException;
import com.phillippitts.bbdetector.service.state.SessionField;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON wire format of the session protocol. Every message is an object with a {@code type}
 * discriminator.
 */
public final class SyncMessages {

    public static final String AUTH = "bb-auth";
    public static final String DEATH = "bb-death";
    public static final String BOSS_DEATH = "bb-boss-death";
    public static final String START = "bb-start";
    public static final String STOP = "bb-stop";
    public static final String RESET = "bb-reset";
    public static final String BOSS_START = "bb-boss-start";
    public static final String BOSS_PAUSE = "bb-boss-pause";
    public static final String BOSS_RESUME = "bb-boss-resume";
    public static final String BOSS_VICTORY = "bb-boss-victory";
    public static final String BOSS_CANCEL = "bb-boss-cancel";
    public static final String SET_TIME = "bb-set-time";
    public static final String SET_DEATHS = "bb-set-deaths";
    public static final String MILESTONE_ADD = "bb-milestone-add";
    public static final String MILESTONE_EDIT = "bb-milestone-edit";
    public static final String MILESTONE_DELETE = "bb-milestone-delete";
    public static final String STATS_ADD = "bb-stats-add";
    public static final String STATS_EDIT = "bb-stats-edit";
    public static final String STATS_DELETE = "bb-stats-delete";

    static final String STATE = "bb-state";
    static final String AUTH_RESULT = "bb-auth-result";
    static final String ERROR = "bb-error";

    public static final String DEFAULT_MILESTONE_ICON = "★";

    /** Wire key → session field, in the order fields are merged. */
    private static final Map<String, SessionField<?>> STATE_FIELDS;

    static {
        Map<String, SessionField<?>> m = new LinkedHashMap<>();
        m.put("deaths", SessionField.DEATH_COUNT);
        m.put("elapsed", SessionField.ELAPSED_MS);
        m.put("isRunning", SessionField.RUNNING);
        m.put("bossFightMode", SessionField.BOSS_MODE);
        m.put("bossDeaths", SessionField.BOSS_DEATH_COUNT);
        m.put("bossPaused", SessionField.BOSS_PAUSED);
        m.put("canEdit", SessionField.CAN_EDIT);
        m.put("profileName", SessionField.PROFILE_ID);
        m.put("displayName", SessionField.PROFILE_DISPLAY_NAME);
        STATE_FIELDS = Collections.unmodifiableMap(m);
    }

    private SyncMessages() {}

    /** Marker for decoded inbound messages. */
    public interface Inbound { }

    /** Authoritative snapshot; only the fields present on the wire are included. */
    public record StateSnapshot(Map<SessionField<?>, Object> values) implements Inbound {
        public StateSnapshot {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public boolean canEdit() {
            return Boolean.TRUE.equals(values.get(SessionField.CAN_EDIT));
        }
    }

    public record AuthResult(boolean success, String error) implements Inbound { }

    public record ServerError(String error, String code) implements Inbound { }

    /** Well-formed message of a type this client does not handle. */
    public record Unhandled(String type) implements Inbound { }

    /**
     * Parses one inbound text frame.
     *
     * @throws SyncProtocolException if the frame is not a JSON object with a string {@code type}
     *         or a known message carries values of the wrong shape
     */
    public static Inbound decode(String text) {
        JSONObject json;
        try {
            json = new JSONObject(Objects.requireNonNullElse(text, ""));
        } catch (JSONException e) {
            throw new SyncProtocolException("Not a JSON object", e);
        }
        Object type = json.opt("type");
        if (!(type instanceof String t)) {
            throw new SyncProtocolException("Missing message type");
        }
        return switch (t) {
            case STATE -> decodeState(json);
            case AUTH_RESULT -> new AuthResult(json.optBoolean("success", false), optString(json, "error"));
            case ERROR -> new ServerError(optString(json, "error"), optString(json, "code"));
            default -> new Unhandled(t);
        };
    }

    private static StateSnapshot decodeState(JSONObject json) {
        Map<SessionField<?>, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, SessionField<?>> e : STATE_FIELDS.entrySet()) {
            if (!json.has(e.getKey())) {
                continue;
            }
            Object raw = json.get(e.getKey());
            try {
                values.put(e.getValue(), e.getValue().coerce(JSONObject.NULL.equals(raw) ? null : raw));
            } catch (IllegalArgumentException ex) {
                throw new SyncProtocolException("Bad value for '" + e.getKey() + "': " + ex.getMessage(), ex);
            }
        }
        return new StateSnapshot(values);
    }

    private static String optString(JSONObject json, String key) {
        Object v = json.opt(key);
        return (v == null || JSONObject.NULL.equals(v)) ? null : String.valueOf(v);
    }

    public static String auth(String password) {
        return message(AUTH).put("password", password).toString();
    }

    /** Message carrying only its type, e.g. {@code {"type":"bb-death"}}. */
    public static String command(String type) {
        return message(type).toString();
    }

    public static String bossVictory(String name) {
        return message(BOSS_VICTORY).put("name", name == null ? "" : name).toString();
    }

    public static String setTime(long elapsedMs) {
        return message(SET_TIME).put("elapsed", elapsedMs).toString();
    }

    public static String setDeaths(int deaths) {
        return message(SET_DEATHS).put("deaths", deaths).toString();
    }

    public static String milestoneAdd(String name, String icon) {
        return message(MILESTONE_ADD)
                .put("name", name)
                .put("icon", icon == null || icon.isBlank() ? DEFAULT_MILESTONE_ICON : icon)
                .toString();
    }

    /** @param timestamp optional; omitted from the message when null */
    public static String milestoneEdit(String id, String name, String icon, Long timestamp) {
        JSONObject json = message(MILESTONE_EDIT).put("id", id).put("name", name).put("icon", icon);
        if (timestamp != null) {
            json.put("timestamp", timestamp.longValue());
        }
        return json.toString();
    }

    public static String milestoneDelete(String id) {
        return message(MILESTONE_DELETE).put("id", id).toString();
    }

    public static String statsAdd(CharacterStats stats) {
        return withStats(message(STATS_ADD), stats).toString();
    }

    public static String statsEdit(String id, CharacterStats stats) {
        return withStats(message(STATS_EDIT).put("id", id), stats).toString();
    }

    public static String statsDelete(String id) {
        return message(STATS_DELETE).put("id", id).toString();
    }

    private static JSONObject withStats(JSONObject json, CharacterStats stats) {
        return json.put("level", stats.level())
                .put("vitality", stats.vitality())
                .put("endurance", stats.endurance())
                .put("strength", stats.strength())
                .put("skill", stats.skill())
                .put("bloodtinge", stats.bloodtinge())
                .put("arcane", stats.arcane());
    }

    private static JSONObject message(String type) {
        return new JSONObject().put("type", type);
    }
}
