package com.phillippitts.vinylscrobbler.service.events;

import com.phillippitts.vinylscrobbler.service.session.event.SessionErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing session error events. Throttled to avoid log spam
 * when a device keeps failing; fatal errors are never throttled.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSessionError(SessionErrorEvent e) {
        if (e.fatal()) {
            LOG.error("Session {} stopped: {}. Check the audio device and restart with POST /start.",
                    e.sessionId(), e.detail());
            return;
        }
        if (shouldLog(e.reason())) {
            LOG.warn("Session {} recovering from {}: {}", e.sessionId(), e.reason(), e.detail());
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
