package com.phillippitts.bbdetector.service.sync.event;

import java.time.Instant;

/**
 * Published when the session connection completes its handshake.
 */
public record SyncConnectedEvent(String profile, Instant at) { }
