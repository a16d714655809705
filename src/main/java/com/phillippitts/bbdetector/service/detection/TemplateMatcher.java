package com.phillippitts.bbdetector.service.detection;

import com.phillippitts.bbdetector.service.capture.Frame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Matcher} based on zero-mean normalized cross-correlation.
 *
 * <p>The frame (normally the calibrated death region) is converted to intensity and resampled
 * to the template's working size, then correlated pixel by pixel. Scaling the frame instead of
 * sliding the template keeps a tick cheap and makes the score independent of capture
 * resolution.
 *
 * <p>Template and threshold live together in one immutable {@link Settings} behind an
 * {@link AtomicReference}; {@link #isMatch} reads it once, so a concurrent {@link #reload} is
 * seen either entirely or not at all.
 */
public class TemplateMatcher implements Matcher {

    private static final Logger LOG = LogManager.getLogger(TemplateMatcher.class);

    public static final double DEFAULT_THRESHOLD = 0.75;
    public static final double MIN_THRESHOLD = 0.5;
    public static final double MAX_THRESHOLD = 0.95;

    private record Settings(ReferenceTemplate template, double threshold) { }

    private final AtomicReference<Settings> settings;

    public TemplateMatcher() {
        this(ReferenceTemplate.empty(), DEFAULT_THRESHOLD);
    }

    public TemplateMatcher(ReferenceTemplate template, double threshold) {
        this.settings = new AtomicReference<>(validated(template, threshold));
    }

    @Override
    public double score(Frame frame, ReferenceTemplate template) {
        if (frame == null || frame.isEmpty() || template == null || template.isEmpty()) {
            return 0.0;
        }
        GrayImage reference = template.working();
        GrayImage candidate = GrayImage.from(frame.image()).resize(reference.width(), reference.height());
        double score = GrayImage.correlate(candidate, reference);
        return Double.isNaN(score) ? 0.0 : score;
    }

    @Override
    public MatchResult isMatch(Frame frame) {
        Settings s = settings.get();
        if (frame == null || frame.isEmpty() || s.template().isEmpty()) {
            return MatchResult.none();
        }
        return MatchResult.of(score(frame, s.template()), s.threshold());
    }

    @Override
    public void reload(ReferenceTemplate template, double threshold) {
        Settings next = validated(template, threshold);
        settings.set(next);
        LOG.info("Matcher reloaded: template={}, threshold={}", next.template(), next.threshold());
    }

    @Override
    public double threshold() {
        return settings.get().threshold();
    }

    @Override
    public ReferenceTemplate template() {
        return settings.get().template();
    }

    private static Settings validated(ReferenceTemplate template, double threshold) {
        Objects.requireNonNull(template, "template");
        if (threshold < MIN_THRESHOLD || threshold > MAX_THRESHOLD) {
            throw new IllegalArgumentException("threshold must be within [" + MIN_THRESHOLD + ", "
                    + MAX_THRESHOLD + "], got " + threshold);
        }
        return new Settings(template, threshold);
    }
}
