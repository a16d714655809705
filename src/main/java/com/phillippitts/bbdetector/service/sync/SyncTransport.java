package com.phillippitts.bbdetector.service.sync;

import java.net.URI;

/**
 * Abstraction over the bidirectional message transport (WebSocket in production).
 *
 * Provides a test seam so unit tests can drive the connection lifecycle directly
 * without opening sockets.
 */
public interface SyncTransport {

    /**
     * Starts connecting asynchronously. Handshake outcome is reported through the listener;
     * implementations must not block on network I/O here.
     */
    SyncConnection open(URI target, SyncTransportListener listener);
}
