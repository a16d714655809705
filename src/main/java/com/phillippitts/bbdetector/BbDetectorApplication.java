package com.phillippitts.bbdetector;

import com.phillippitts.bbdetector.config.properties.DetectionProperties;
import com.phillippitts.bbdetector.config.properties.EngineProperties;
import com.phillippitts.bbdetector.config.properties.HotkeyProperties;
import com.phillippitts.bbdetector.config.properties.SyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        DetectionProperties.class,
        SyncProperties.class,
        HotkeyProperties.class,
        EngineProperties.class
})
@EnableScheduling
public class BbDetectorApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(BbDetectorApplication.class);
        // Screen capture needs a display
        app.setHeadless(false);
        app.run(args);
    }

}
