package com.phillippitts.bbdetector.service.engine;

/**
 * Thread-safe entry point into the engine's single command-dispatch path.
 * Producers (hotkey thread, HTTP threads) never touch session state or the network themselves.
 */
@FunctionalInterface
public interface CommandChannel {

    /**
     * Enqueues a command without blocking.
     *
     * @return false if the command was rejected (engine not accepting commands)
     */
    boolean submit(EngineCommand command);
}
