package com.phillippitts.bbdetector.service.sync.event;

import java.time.Instant;

/**
 * Published when the session connection is lost or closed.
 *
 * @param reason short, PII-free description (close reason or error class)
 * @param willRetry false only for a deliberate disconnect
 */
public record SyncDisconnectedEvent(String profile, String reason, boolean willRetry, Instant at) { }
