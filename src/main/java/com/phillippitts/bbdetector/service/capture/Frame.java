package com.phillippitts.bbdetector.service.capture;

import java.awt.image.BufferedImage;
import java.time.Instant;

/**
 * One captured rectangular pixel buffer. Any {@link BufferedImage} type is accepted;
 * consumers normalize channel depth themselves.
 */
public record Frame(BufferedImage image, Instant capturedAt) {

    public Frame {
        if (capturedAt == null) {
            capturedAt = Instant.now();
        }
    }

    public static Frame of(BufferedImage image) {
        return new Frame(image, Instant.now());
    }

    /** True when there is nothing to look at (no image or a zero-sized one). */
    public boolean isEmpty() {
        return image == null || image.getWidth() <= 0 || image.getHeight() <= 0;
    }

    public int width() {
        return image == null ? 0 : image.getWidth();
    }

    public int height() {
        return image == null ? 0 : image.getHeight();
    }
}
