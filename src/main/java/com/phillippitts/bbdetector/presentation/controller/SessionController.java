package com.phillippitts.bbdetector.presentation.controller;

import com.phillippitts.bbdetector.service.engine.CommandChannel;
import com.phillippitts.bbdetector.service.engine.EngineCommand;
import com.phillippitts.bbdetector.service.state.SharedState;
import com.phillippitts.bbdetector.service.sync.CharacterStats;
import com.phillippitts.bbdetector.service.sync.Milestone;
import com.phillippitts.bbdetector.service.sync.SyncClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local REST surface for overlays and stream-deck style controllers.
 *
 * Commands are only queued here; the engine thread executes them on its next tick.
 */
@RestController
@RequestMapping("/api")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final SharedState state;
    private final CommandChannel commands;
    private final SyncClient sync;

    SessionController(SharedState state, CommandChannel commands, SyncClient sync) {
        this.state = state;
        this.commands = commands;
        this.sync = sync;
    }

    @GetMapping("/session")
    Map<String, Object> session() {
        Map<String, Object> body = new LinkedHashMap<>(state.snapshot().asMap());
        body.put("connectionState", sync.connectionState().name());
        return body;
    }

    @GetMapping("/session/{field}")
    Map<String, Object> field(@PathVariable String field) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field", field);
        body.put("value", state.get(field));
        return body;
    }

    /**
     * Queues a command by its kebab-case name, e.g. {@code POST /api/commands/manual-death}.
     * Arguments come from the optional JSON body:
     * <ul>
     *   <li>{@code boss-victory}: {@code name}</li>
     *   <li>{@code set-elapsed}, {@code set-deaths}: {@code value}</li>
     *   <li>{@code milestone-add}: {@code name}, {@code icon}; {@code milestone-edit} adds {@code id}
     *       and {@code timestamp}; {@code milestone-delete}: {@code id}</li>
     *   <li>{@code stats-add}: {@code stats}; {@code stats-edit}: {@code id}, {@code stats};
     *       {@code stats-delete}: {@code id}</li>
     *   <li>{@code reload-template}: {@code location}</li>
     * </ul>
     * Answers 503 when the engine is not running or its queue is full.
     */
    @PostMapping("/commands/{command}")
    ResponseEntity<Map<String, Object>> command(@PathVariable String command,
                                                @RequestBody(required = false) CommandRequest request) {
        EngineCommand.Type type = EngineCommand.Type.fromWireName(command)
                .orElseThrow(() -> new IllegalArgumentException("Unknown command: " + command));
        EngineCommand engineCommand = toCommand(type, request == null ? CommandRequest.EMPTY : request);
        return submit(engineCommand);
    }

    /** Replaces the detection template; the swap happens on the engine thread. */
    @PostMapping("/template")
    ResponseEntity<Map<String, Object>> template(@RequestBody TemplateRequest request) {
        String location = requireText(EngineCommand.Type.RELOAD_TEMPLATE, "location", request.location());
        return submit(EngineCommand.reloadTemplate(location.trim(), "api"));
    }

    private ResponseEntity<Map<String, Object>> submit(EngineCommand engineCommand) {
        EngineCommand.Type type = engineCommand.type();
        boolean accepted = commands.submit(engineCommand);
        LOG.info("Command {} {}", type.wireName(), accepted ? "queued" : "rejected");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("command", type.wireName());
        body.put("accepted", accepted);
        return ResponseEntity.status(accepted ? HttpStatus.ACCEPTED : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private static EngineCommand toCommand(EngineCommand.Type type, CommandRequest request) {
        return switch (type) {
            case BOSS_VICTORY -> EngineCommand.bossVictory(request.name(), "api");
            case SET_ELAPSED -> EngineCommand.setElapsed(requireValue(type, request), "api");
            case SET_DEATHS -> EngineCommand.setDeaths(Math.toIntExact(requireValue(type, request)), "api");
            case MILESTONE_ADD -> EngineCommand.addMilestone(requireText(type, "name", request.name()),
                    request.icon(), "api");
            case MILESTONE_EDIT -> EngineCommand.editMilestone(new Milestone(requireText(type, "id", request.id()),
                    requireText(type, "name", request.name()), request.icon(), request.timestamp()), "api");
            case MILESTONE_DELETE -> EngineCommand.deleteMilestone(requireText(type, "id", request.id()), "api");
            case STATS_ADD -> EngineCommand.addStats(requireStats(type, request), "api");
            case STATS_EDIT -> EngineCommand.editStats(requireText(type, "id", request.id()),
                    requireStats(type, request), "api");
            case STATS_DELETE -> EngineCommand.deleteStats(requireText(type, "id", request.id()), "api");
            case RELOAD_TEMPLATE -> EngineCommand.reloadTemplate(
                    requireText(type, "location", request.location()).trim(), "api");
            default -> EngineCommand.of(type, "api");
        };
    }

    private static String requireText(EngineCommand.Type type, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(type.wireName() + " requires '" + field + "'");
        }
        return value;
    }

    private static CharacterStats requireStats(EngineCommand.Type type, CommandRequest request) {
        if (request.stats() == null) {
            throw new IllegalArgumentException(type.wireName() + " requires 'stats'");
        }
        return request.stats();
    }

    private static long requireValue(EngineCommand.Type type, CommandRequest request) {
        if (request.value() == null) {
            throw new IllegalArgumentException(type.wireName() + " requires a numeric 'value'");
        }
        return request.value();
    }

    /** Switches the session connection to another profile and reconnects. */
    @PostMapping("/profile")
    ResponseEntity<Map<String, Object>> profile(@RequestBody ProfileRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Profile name must not be blank");
        }
        sync.switchProfile(request.name(), request.password());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("profile", request.name().trim());
        body.put("connectionState", sync.connectionState().name());
        return ResponseEntity.accepted().body(body);
    }

    record CommandRequest(String name, Long value, String id, String icon, Long timestamp, String location,
                          CharacterStats stats) {
        static final CommandRequest EMPTY = new CommandRequest(null, null, null, null, null, null, null);
    }

    record TemplateRequest(String location) { }

    record ProfileRequest(String name, String password) { }
}
