package com.phillippitts.bbdetector.service.events;

import com.phillippitts.bbdetector.service.capture.CaptureErrorEvent;
import com.phillippitts.bbdetector.service.hotkey.event.HotkeyConflictEvent;
import com.phillippitts.bbdetector.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.bbdetector.service.sync.event.AuthenticationResultEvent;
import com.phillippitts.bbdetector.service.sync.event.SyncDisconnectedEvent;
import com.phillippitts.bbdetector.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing error events. Privacy-safe and throttled to avoid log spam
 * while the connection sits in its retry loop.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onHotkeyPermissionDenied(HotkeyPermissionDeniedEvent e) {
        if (shouldLog("hotkey-permission")) {
            LOG.warn("Hotkey permission denied. On macOS grant Accessibility: "
                    + "System Settings → Privacy & Security → Accessibility (then restart app)");
        }
    }

    @EventListener
    void onHotkeyConflict(HotkeyConflictEvent e) {
        String key = "hotkey-conflict-" + e.action() + '-' + e.combination();
        if (shouldLog(key)) {
            LOG.warn("Hotkey for {} ({}) conflicts with OS-reserved shortcut {}. Update hotkey.bindings.{}",
                    e.action(), e.combination(), e.reserved(), e.action());
        }
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Capture error: reason={}. Automatic detection is paused; on macOS grant Screen Recording "
                    + "permission.", e.reason());
        }
    }

    @EventListener
    void onAuthenticationResult(AuthenticationResultEvent e) {
        if (!e.success() && shouldLog("auth-" + e.profile())) {
            LOG.warn("Authentication rejected for profile '{}': {}. Commands stay disabled until the password "
                    + "is fixed (sync.password) and the connection is re-established.",
                    e.profile(), LogSanitizer.truncate(e.error(), 80));
        }
    }

    @EventListener
    void onDisconnected(SyncDisconnectedEvent e) {
        if (e.willRetry() && shouldLog("connection-lost")) {
            LOG.warn("Lost connection to session service ({}); retrying in the background", e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
