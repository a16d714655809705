package com.phillippitts.bbdetector.service.sync;

/**
 * One open (or opening) transport connection.
 */
public interface SyncConnection {

    /**
     * Enqueues a text frame without blocking.
     *
     * @return false if the connection is closing or its outbound buffer is full
     */
    boolean send(String text);

    /** Starts a graceful close. Idempotent. */
    void close(int code, String reason);
}
