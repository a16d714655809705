package com.phillippitts.bbdetector.service.capture;

import java.util.Optional;

/**
 * Supplies screen pixels on demand.
 *
 * Contract:
 * - Never throws for transient conditions (display asleep, permission missing, resize);
 *   returns {@link Optional#empty()} instead
 * - Coordinates of {@link #grabRegion} are relative to the selected monitor
 */
public interface FrameSource {

    /** Captures the whole selected monitor. */
    Optional<Frame> grab();

    /** Captures a sub-rectangle of the selected monitor. */
    Optional<Frame> grabRegion(int x, int y, int width, int height);

    /** False when the backend cannot capture at all (e.g. headless). */
    boolean isAvailable();
}
