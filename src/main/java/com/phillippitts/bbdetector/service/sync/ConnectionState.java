package com.phillippitts.bbdetector.service.sync;

/**
 * Lifecycle of the single logical session connection.
 *
 * <pre>
 * DISCONNECTED → CONNECTING → CONNECTED → AUTHENTICATED
 *       ↑             |            |             |
 *       └─────────────┴────────────┴─────────────┘  (close, error, failed send)
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    /** Handshake done, read-only: snapshots flow in, commands are dropped. */
    CONNECTED,
    /** Edit rights granted, commands are sent. */
    AUTHENTICATED;

    public boolean isOpen() {
        return this == CONNECTED || this == AUTHENTICATED;
    }
}
