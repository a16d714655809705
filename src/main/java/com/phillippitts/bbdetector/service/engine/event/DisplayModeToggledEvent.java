package com.phillippitts.bbdetector.service.engine.event;

import java.time.Instant;

/**
 * Published when the user asks to switch between compact and full display. The engine keeps no
 * display state; renderers listen for this event.
 */
public record DisplayModeToggledEvent(Instant at) { }
