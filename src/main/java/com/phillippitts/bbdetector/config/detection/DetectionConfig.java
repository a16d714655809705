package com.phillippitts.bbdetector.config.detection;

import com.phillippitts.bbdetector.config.properties.DetectionProperties;
import com.phillippitts.bbdetector.service.detection.EventGate;
import com.phillippitts.bbdetector.service.detection.Matcher;
import com.phillippitts.bbdetector.service.detection.TemplateLoader;
import com.phillippitts.bbdetector.service.detection.TemplateMatcher;
import com.phillippitts.bbdetector.service.state.SessionField;
import com.phillippitts.bbdetector.service.state.SharedState;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the session store and the detection pipeline from {@link DetectionProperties}.
 */
@Configuration
public class DetectionConfig {

    @Bean
    public SharedState sharedState(DetectionProperties props) {
        SharedState state = new SharedState();
        state.set(SessionField.DETECTION_ENABLED, props.isEnabledOnStart());
        return state;
    }

    @Bean
    public Matcher templateMatcher(TemplateLoader loader, DetectionProperties props) {
        return new TemplateMatcher(loader.loadOrEmpty(props.getTemplatePath()), props.getThreshold());
    }

    @Bean
    public EventGate eventGate(Matcher matcher, SharedState state, DetectionProperties props) {
        return new EventGate(matcher, state, props.getCooldown(), props.getConsecutiveHits());
    }
}
