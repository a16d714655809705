package com.phillippitts.bbdetector.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Engine loop switches.
 */
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    /** Start the tick loop with the application. Tests turn this off. */
    private final boolean autoStart;

    @ConstructorBinding
    public EngineProperties(Boolean autoStart) {
        this.autoStart = autoStart == null || autoStart;
    }

    public boolean isAutoStart() {
        return autoStart;
    }
}
