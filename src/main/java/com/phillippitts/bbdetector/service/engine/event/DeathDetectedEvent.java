package com.phillippitts.bbdetector.service.engine.event;

import java.time.Instant;

/**
 * Published when the detector reports a death.
 *
 * @param sent false when the command was dropped (not authenticated) or the send failed
 */
public record DeathDetectedEvent(Instant at, boolean boss, double confidence, boolean sent) { }
