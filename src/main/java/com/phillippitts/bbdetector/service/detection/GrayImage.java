package com.phillippitts.bbdetector.service.detection;

import java.awt.image.BufferedImage;

/**
 * Single-channel intensity image used for matching. Built from any {@link BufferedImage}
 * (RGB, ARGB, BGR, gray, indexed) so frames and templates are always compared on the same
 * channel depth.
 */
final class GrayImage {

    private final int width;
    private final int height;
    private final float[] luma;

    private GrayImage(int width, int height, float[] luma) {
        this.width = width;
        this.height = height;
        this.luma = luma;
    }

    static GrayImage from(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] rgb = image.getRGB(0, 0, w, h, null, 0, w);
        float[] out = new float[w * h];
        for (int i = 0; i < rgb.length; i++) {
            int p = rgb[i];
            int r = (p >> 16) & 0xFF;
            int g = (p >> 8) & 0xFF;
            int b = p & 0xFF;
            // ITU-R BT.601 luma
            out[i] = 0.299f * r + 0.587f * g + 0.114f * b;
        }
        return new GrayImage(w, h, out);
    }

    int width() {
        return width;
    }

    int height() {
        return height;
    }

    /** Bilinear resample to the given size. Returns this when the size already matches. */
    GrayImage resize(int targetWidth, int targetHeight) {
        if (targetWidth == width && targetHeight == height) {
            return this;
        }
        float[] out = new float[targetWidth * targetHeight];
        double sx = (double) width / targetWidth;
        double sy = (double) height / targetHeight;
        for (int y = 0; y < targetHeight; y++) {
            double fy = Math.max(0, (y + 0.5) * sy - 0.5);
            int y0 = Math.min((int) fy, height - 1);
            int y1 = Math.min(y0 + 1, height - 1);
            double wy = fy - y0;
            for (int x = 0; x < targetWidth; x++) {
                double fx = Math.max(0, (x + 0.5) * sx - 0.5);
                int x0 = Math.min((int) fx, width - 1);
                int x1 = Math.min(x0 + 1, width - 1);
                double wx = fx - x0;
                double top = luma[y0 * width + x0] * (1 - wx) + luma[y0 * width + x1] * wx;
                double bottom = luma[y1 * width + x0] * (1 - wx) + luma[y1 * width + x1] * wx;
                out[y * targetWidth + x] = (float) (top * (1 - wy) + bottom * wy);
            }
        }
        return new GrayImage(targetWidth, targetHeight, out);
    }

    /**
     * Zero-mean normalized cross-correlation of two equally sized images.
     * Returns a value in [-1, 1]; 0 when either image has no contrast at all.
     */
    static double correlate(GrayImage a, GrayImage b) {
        if (a.width != b.width || a.height != b.height) {
            throw new IllegalArgumentException("size mismatch: " + a.width + "x" + a.height
                    + " vs " + b.width + "x" + b.height);
        }
        int n = a.luma.length;
        double meanA = 0;
        double meanB = 0;
        for (int i = 0; i < n; i++) {
            meanA += a.luma[i];
            meanB += b.luma[i];
        }
        meanA /= n;
        meanB /= n;

        double cov = 0;
        double varA = 0;
        double varB = 0;
        for (int i = 0; i < n; i++) {
            double da = a.luma[i] - meanA;
            double db = b.luma[i] - meanB;
            cov += da * db;
            varA += da * da;
            varB += db * db;
        }
        double denom = Math.sqrt(varA * varB);
        if (denom < 1e-9) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, cov / denom));
    }
}
