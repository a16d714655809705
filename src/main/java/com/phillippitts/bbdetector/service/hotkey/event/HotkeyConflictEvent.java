package com.phillippitts.bbdetector.service.hotkey.event;

import java.time.Instant;

/**
 * Published when a configured hotkey conflicts with an OS-reserved shortcut
 * (e.g., Alt+F4 on Windows, Cmd+Q on macOS).
 */
public record HotkeyConflictEvent(String action, String combination, String reserved, Instant at) { }
