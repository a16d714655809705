package com.phillippitts.bbdetector.service.capture;

import java.time.Instant;

/**
 * Published when screen capture becomes unavailable (headless, missing permission,
 * monitor gone). Payload is a short reason and timestamp.
 */
public record CaptureErrorEvent(String reason, Instant at) { }
