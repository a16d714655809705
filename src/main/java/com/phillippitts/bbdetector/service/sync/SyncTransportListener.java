package com.phillippitts.bbdetector.service.sync;

/**
 * Callbacks for a single connection attempt. Invoked on transport threads.
 * After {@link #onClosed} or {@link #onFailure} no further callbacks arrive for that attempt.
 */
public interface SyncTransportListener {

    void onOpen(SyncConnection connection);

    void onMessage(SyncConnection connection, String text);

    void onClosed(SyncConnection connection, int code, String reason);

    void onFailure(SyncConnection connection, Throwable error);
}
