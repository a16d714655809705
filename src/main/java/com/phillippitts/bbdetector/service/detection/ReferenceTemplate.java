package com.phillippitts.bbdetector.service.detection;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Immutable reference pattern of the on-screen death indicator plus its derived intensity
 * representation. Replaced wholesale on reload, never modified.
 *
 * <p>Large templates are reduced to {@link #MAX_WORKING_WIDTH} for matching; the aspect ratio
 * is kept.
 */
public final class ReferenceTemplate {

    static final int MAX_WORKING_WIDTH = 160;

    private static final ReferenceTemplate EMPTY = new ReferenceTemplate("none", null);

    private final String name;
    private final GrayImage working;
    private final int sourceWidth;
    private final int sourceHeight;

    private ReferenceTemplate(String name, BufferedImage image) {
        this.name = name;
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            this.working = null;
            this.sourceWidth = 0;
            this.sourceHeight = 0;
            return;
        }
        this.sourceWidth = image.getWidth();
        this.sourceHeight = image.getHeight();
        GrayImage gray = GrayImage.from(image);
        if (sourceWidth > MAX_WORKING_WIDTH) {
            int h = Math.max(1, Math.round((float) sourceHeight * MAX_WORKING_WIDTH / sourceWidth));
            gray = gray.resize(MAX_WORKING_WIDTH, h);
        }
        this.working = gray;
    }

    public static ReferenceTemplate of(String name, BufferedImage image) {
        return new ReferenceTemplate(Objects.requireNonNull(name, "name"), image);
    }

    /** Template that never matches anything. */
    public static ReferenceTemplate empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return working == null;
    }

    public String name() {
        return name;
    }

    public int sourceWidth() {
        return sourceWidth;
    }

    public int sourceHeight() {
        return sourceHeight;
    }

    GrayImage working() {
        return working;
    }

    @Override
    public String toString() {
        return isEmpty() ? "ReferenceTemplate[empty]"
                : "ReferenceTemplate[" + name + ", " + sourceWidth + "x" + sourceHeight + "]";
    }
}
