package com.phillippitts.bbdetector.service.state;

/**
 * Hook invoked when a {@link StateChangeListener} throws. The failure is isolated:
 * remaining listeners are still notified and the writer never sees the exception.
 */
@FunctionalInterface
public interface ListenerErrorHandler {

    void onListenerError(StateChangeListener listener, SessionField<?> field, RuntimeException error);
}
