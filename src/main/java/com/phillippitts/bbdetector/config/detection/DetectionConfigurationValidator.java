package com.phillippitts.bbdetector.config.detection;

import com.phillippitts.bbdetector.config.properties.DetectionProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Checks the discrete detection settings that bean validation cannot express.
 */
@Component
class DetectionConfigurationValidator {

    static final Set<Integer> ALLOWED_FPS = Set.of(5, 10, 15, 20, 30);
    static final Set<Integer> ALLOWED_COOLDOWN_SECONDS = Set.of(3, 5, 10);

    private final DetectionProperties props;

    DetectionConfigurationValidator(DetectionProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        if (!ALLOWED_FPS.contains(props.getFps())) {
            throw new IllegalArgumentException("Invalid detection.fps: " + props.getFps()
                    + ". Allowed: 5, 10, 15, 20, 30.");
        }
        if (!ALLOWED_COOLDOWN_SECONDS.contains(props.getCooldownSeconds())) {
            throw new IllegalArgumentException("Invalid detection.cooldown-seconds: " + props.getCooldownSeconds()
                    + ". Allowed: 3, 5, 10.");
        }
        if (props.getThreshold() < 0.5 || props.getThreshold() > 0.95) {
            throw new IllegalArgumentException("Invalid detection.threshold: " + props.getThreshold()
                    + ". Must be within [0.5, 0.95].");
        }
    }
}
