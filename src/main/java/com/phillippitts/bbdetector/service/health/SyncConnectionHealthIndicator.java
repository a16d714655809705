package com.phillippitts.bbdetector.service.health;

import com.phillippitts.bbdetector.service.capture.FrameSource;
import com.phillippitts.bbdetector.service.detection.Matcher;
import com.phillippitts.bbdetector.service.state.SessionSnapshot;
import com.phillippitts.bbdetector.service.state.SharedState;
import com.phillippitts.bbdetector.service.sync.ConnectionState;
import com.phillippitts.bbdetector.service.sync.SyncClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the session connection.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: connected and authenticated (commands are sent)</li>
 *   <li>DEGRADED: connected read-only (counters flow in, commands are dropped)</li>
 *   <li>DOWN: not connected (connecting or waiting to retry)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SyncConnectionHealthIndicator implements HealthIndicator {

    private final SyncClient sync;
    private final SharedState state;
    private final FrameSource frames;
    private final Matcher matcher;

    public SyncConnectionHealthIndicator(SyncClient sync, SharedState state, FrameSource frames, Matcher matcher) {
        this.sync = sync;
        this.state = state;
        this.frames = frames;
        this.matcher = matcher;
    }

    @Override
    public Health health() {
        ConnectionState connection = sync.connectionState();
        SessionSnapshot snap = state.snapshot();

        Health.Builder builder = switch (connection) {
            case AUTHENTICATED -> new Health.Builder().up().withDetail("status", "Connected with edit rights");
            case CONNECTED -> new Health.Builder().status("DEGRADED").withDetail("status", "Connected read-only");
            default -> new Health.Builder().down().withDetail("status", "Not connected");
        };
        return builder
                .withDetail("connection", connection.name())
                .withDetail("profile", sync.currentProfile())
                .withDetail("detection", describeDetection(snap))
                .build();
    }

    private String describeDetection(SessionSnapshot snap) {
        if (!snap.detectionEnabled()) {
            return "disabled";
        }
        if (!frames.isAvailable()) {
            return "no capture";
        }
        return matcher.template().isEmpty() ? "no template" : "active";
    }
}
