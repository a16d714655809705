package com.phillippitts.bbdetector.service.detection;

import com.phillippitts.bbdetector.service.capture.Frame;

/**
 * Similarity test of a frame against one loaded reference template.
 * Implementations must be deterministic for identical inputs and safe to reload while
 * another thread is matching.
 */
public interface Matcher {

    /** Similarity in [-1, 1]; 0 when either side is missing or empty. */
    double score(Frame frame, ReferenceTemplate template);

    /** Scores the frame against the current template and applies the current threshold. */
    MatchResult isMatch(Frame frame);

    /** Atomically replaces template and threshold. */
    void reload(ReferenceTemplate template, double threshold);

    double threshold();

    ReferenceTemplate template();
}
