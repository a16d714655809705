package com.phillippitts.bbdetector.service.detection;

/**
 * Outcome of one match test.
 *
 * @param matched    whether confidence reached the threshold (inclusive)
 * @param confidence similarity score in [-1, 1]; 0 when nothing could be compared
 */
public record MatchResult(boolean matched, double confidence) {

    private static final MatchResult NONE = new MatchResult(false, 0.0);

    public static MatchResult none() {
        return NONE;
    }

    public static MatchResult of(double score, double threshold) {
        return new MatchResult(score >= threshold, score);
    }
}
