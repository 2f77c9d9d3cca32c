package com.phillippitts.vinylscrobbler.service.session.event;

import java.time.Instant;

/**
 * Published when a session hits an error, recovered or not.
 *
 * @param sessionId session the error belongs to
 * @param reason    short machine-friendly reason, e.g. {@code DEVICE_IO_ERROR}
 * @param detail    human-readable message
 * @param fatal     whether the session was stopped
 * @param timestamp when the error occurred
 */
public record SessionErrorEvent(
        String sessionId,
        String reason,
        String detail,
        boolean fatal,
        Instant timestamp
) {}
