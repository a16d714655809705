package com.phillippitts.bbdetector.service.state;

/**
 * Receives one callback per changed field, after the change is visible to readers.
 * Called on the writer's thread while writes are serialized, so implementations must be quick
 * and must not block on other threads.
 */
@FunctionalInterface
public interface StateChangeListener {

    void onStateChanged(SessionField<?> field, Object newValue);
}
