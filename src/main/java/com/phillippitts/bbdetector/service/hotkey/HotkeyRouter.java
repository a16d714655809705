package com.phillippitts.bbdetector.service.hotkey;

import com.phillippitts.bbdetector.config.properties.HotkeyProperties;
import com.phillippitts.bbdetector.service.engine.CommandChannel;
import com.phillippitts.bbdetector.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.bbdetector.service.hotkey.event.HotkeyPermissionDeniedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers a global key hook and routes matched key combinations to the engine's
 * {@link CommandChannel}.
 *
 * <p>The router tracks the set of currently held keys. On each press that adds a new key, the
 * held set (plus any modifiers the OS reports) is compared by set equality against the
 * bindings. Key auto-repeat therefore fires once per physical press. Unbound combinations are
 * ignored.
 *
 * <p>Matching runs on the hook thread and only enqueues; it never touches session state or
 * the network. Tests should inject a fake GlobalKeyHook and emit NormalizedKeyEvent instances
 * directly to the registered listener.
 */
@Service
public class HotkeyRouter implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HotkeyRouter.class);

    /** Stopped first, before the engine loop and the sync client. */
    public static final int PHASE = 300;

    private final GlobalKeyHook hook;
    private final CommandChannel commands;
    private final ApplicationEventPublisher publisher;
    private final HotkeyProperties props;

    private final Map<Set<String>, HotkeyAction> bindings = new ConcurrentHashMap<>();
    private final Set<String> held = new HashSet<>();

    private volatile boolean running;

    public HotkeyRouter(GlobalKeyHook hook,
                        CommandChannel commands,
                        HotkeyProperties props,
                        ApplicationEventPublisher publisher) {
        this.hook = hook;
        this.commands = commands;
        this.props = props;
        this.publisher = publisher;
        props.getBindings().forEach((actionKey, combination) -> {
            HotkeyAction action = HotkeyAction.fromKey(actionKey)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown hotkey action: " + actionKey));
            register(combination, action);
        });
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        if (!props.isEnabled()) {
            LOG.info("Global hotkeys disabled (hotkey.enabled=false)");
            return;
        }
        try {
            hook.addListener(this::onKeyEvent);
            hook.register();
            running = true;
            LOG.info("HotkeyRouter started with {} binding(s): {}", bindings.size(), describeBindings());
            detectReservedConflicts();
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.toString());
            publisher.publishEvent(new HotkeyPermissionDeniedEvent(Instant.now()));
        } catch (RuntimeException e) {
            LOG.error("Failed to start HotkeyRouter", e);
            // do not rethrow; the REST surface still accepts commands
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        try {
            hook.unregister();
        } catch (RuntimeException e) {
            LOG.debug("Error unregistering key hook", e);
        }
        synchronized (held) {
            held.clear();
        }
        running = false;
        LOG.info("HotkeyRouter stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    /**
     * Binds a combination such as {@code ctrl+shift+d} to an action. Re-registering a combination
     * replaces its previous action; an action bound elsewhere moves to the new combination.
     *
     * @throws IllegalArgumentException if the combination cannot be parsed
     */
    public void register(String combination, HotkeyAction action) {
        Set<String> keys = KeyNameMapper.parseCombination(combination);
        synchronized (bindings) {
            bindings.values().remove(action);
            HotkeyAction previous = bindings.put(keys, action);
            if (previous != null && previous != action) {
                LOG.info("Hotkey {} rebound from {} to {}", KeyNameMapper.format(keys), previous, action);
            }
        }
    }

    /** Removes the binding for a combination; unknown combinations are ignored. */
    public void unregister(String combination) {
        bindings.remove(KeyNameMapper.parseCombination(combination));
    }

    /** Current bindings as {@code CONTROL+SHIFT+D → MANUAL_DEATH}, sorted by action. */
    public Map<String, HotkeyAction> describeBindings() {
        Map<String, HotkeyAction> out = new LinkedHashMap<>();
        bindings.entrySet().stream()
                .sorted(Map.Entry.comparingByValue())
                .forEach(e -> out.put(KeyNameMapper.format(e.getKey()), e.getValue()));
        return out;
    }

    // Package-private for tests
    void onKeyEvent(NormalizedKeyEvent e) {
        if (e.type() == NormalizedKeyEvent.Type.RELEASED) {
            synchronized (held) {
                held.remove(e.key());
            }
            return;
        }
        Set<String> pressed;
        synchronized (held) {
            if (!held.add(e.key())) {
                return; // auto-repeat
            }
            pressed = Set.copyOf(held);
        }
        HotkeyAction action = bindings.get(pressed);
        if (action == null && !e.modifiers().isEmpty()) {
            Set<String> withReported = new HashSet<>(pressed);
            withReported.addAll(e.modifiers());
            action = bindings.get(withReported);
        }
        if (action == null) {
            return;
        }
        boolean accepted = commands.submit(action.toCommand());
        LOG.debug("Hotkey {} → {} ({})", KeyNameMapper.format(pressed), action, accepted ? "queued" : "rejected");
    }

    private void detectReservedConflicts() {
        for (Map.Entry<Set<String>, HotkeyAction> binding : bindings.entrySet()) {
            for (String spec : props.getReserved()) {
                if (KeyNameMapper.matchesReserved(binding.getKey(), spec)) {
                    String combination = KeyNameMapper.format(binding.getKey());
                    publisher.publishEvent(new HotkeyConflictEvent(binding.getValue().key(), combination,
                            spec, Instant.now()));
                    LOG.warn("Hotkey {} for {} conflicts with reserved '{}'", combination, binding.getValue(), spec);
                    break;
                }
            }
        }
    }
}
