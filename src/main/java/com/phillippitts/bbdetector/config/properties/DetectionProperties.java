package com.phillippitts.bbdetector.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for screen death detection.
 *
 * Discrete values (fps, cooldown) are checked against their allowed sets by
 * {@code DetectionConfigurationValidator}; ranges are validated here on startup.
 */
@Validated
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    /** Capture/evaluate rate. Allowed: 5, 10, 15, 20, 30. */
    @Min(1)
    @Max(30)
    private final int fps;

    /** Minimum seconds between two detected deaths. Allowed: 3, 5, 10. */
    @Min(1)
    private final int cooldownSeconds;

    /** Similarity threshold (inclusive). */
    @DecimalMin("0.5")
    @DecimalMax("0.95")
    private final double threshold;

    /** Consecutive matching ticks required before a death qualifies. */
    @Min(1)
    @Max(10)
    private final int consecutiveHits;

    /** Zero-based monitor index for capture. */
    @Min(0)
    private final int monitor;

    /** Optional capture crop in monitor coordinates; null captures the whole monitor. */
    @Valid
    private final Region region;

    /** Template image: filesystem path or classpath: resource. Blank leaves detection idle. */
    private final String templatePath;

    /** Initial value of the detectionEnabled session flag. */
    private final boolean enabledOnStart;

    @ConstructorBinding
    public DetectionProperties(Integer fps,
                               Integer cooldownSeconds,
                               Double threshold,
                               Integer consecutiveHits,
                               Integer monitor,
                               Region region,
                               String templatePath,
                               Boolean enabledOnStart) {
        this.fps = fps == null ? 10 : fps;
        this.cooldownSeconds = cooldownSeconds == null ? 5 : cooldownSeconds;
        this.threshold = threshold == null ? 0.75 : threshold;
        this.consecutiveHits = consecutiveHits == null ? 1 : consecutiveHits;
        this.monitor = monitor == null ? 0 : monitor;
        this.region = region;
        this.templatePath = templatePath == null ? "" : templatePath.trim();
        this.enabledOnStart = enabledOnStart == null || enabledOnStart;
    }

    public int getFps() {
        return fps;
    }

    public int getCooldownSeconds() {
        return cooldownSeconds;
    }

    public Duration getCooldown() {
        return Duration.ofSeconds(cooldownSeconds);
    }

    public double getThreshold() {
        return threshold;
    }

    public int getConsecutiveHits() {
        return consecutiveHits;
    }

    public int getMonitor() {
        return monitor;
    }

    public Region getRegion() {
        return region;
    }

    public boolean hasRegion() {
        return region != null;
    }

    public String getTemplatePath() {
        return templatePath;
    }

    public boolean isEnabledOnStart() {
        return enabledOnStart;
    }

    /** Capture rectangle relative to the selected monitor. */
    public record Region(@Min(0) int x, @Min(0) int y, @Min(1) int width, @Min(1) int height) { }
}
