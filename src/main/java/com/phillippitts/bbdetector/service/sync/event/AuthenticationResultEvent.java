package com.phillippitts.bbdetector.service.sync.event;

import java.time.Instant;

/**
 * Published when the server answers an authentication request.
 * {@code error} is the server's message on failure, null on success.
 */
public record AuthenticationResultEvent(String profile, boolean success, String error, Instant at) { }
