package com.phillippitts.bbdetector.service.detection;

import java.time.Instant;

/**
 * A qualifying, de-duplicated detection.
 *
 * @param at         evaluation time that produced the event
 * @param boss       boss mode as sampled during that evaluation
 * @param confidence match score that qualified
 */
public record DeathEvent(Instant at, boolean boss, double confidence) { }
