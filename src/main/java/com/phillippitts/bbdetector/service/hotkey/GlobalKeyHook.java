package com.phillippitts.bbdetector.service.hotkey;

import java.util.function.Consumer;

/**
 * Abstraction over a global keyboard hook (e.g., JNativeHook).
 *
 * Provides a test seam so unit tests can inject a fake implementation
 * and remain hermetic (no OS-level hooks required in CI).
 */
public interface GlobalKeyHook {

    /**
     * Register the global hook. Idempotent.
     *
     * @throws SecurityException if the OS refuses the hook (e.g. missing Accessibility permission)
     */
    void register();

    /** Unregister the global hook. Idempotent. */
    void unregister();

    /**
     * Subscribe to normalized key events. Events arrive on the hook's own thread.
     */
    void addListener(Consumer<NormalizedKeyEvent> listener);
}
