package com.phillippitts.vinylscrobbler.config.session;

import com.phillippitts.vinylscrobbler.config.properties.SessionProperties;
import com.phillippitts.vinylscrobbler.exception.SessionStartException;
import com.phillippitts.vinylscrobbler.service.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts a session on the configured (or automatically picked) device once the application is
 * ready, when {@code session.auto-start=true}.
 */
@Component
class SessionAutoStart {

    private static final Logger LOG = LogManager.getLogger(SessionAutoStart.class);

    private final SessionManager sessionManager;
    private final SessionProperties props;

    SessionAutoStart(SessionManager sessionManager, SessionProperties props) {
        this.sessionManager = sessionManager;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    void onReady() {
        if (!props.isAutoStart()) {
            LOG.debug("session.auto-start is off; waiting for POST /start");
            return;
        }
        LOG.info("session.auto-start is on; starting a session");
        try {
            if (!sessionManager.start(null)) {
                LOG.warn("Auto-start skipped: a session is already running");
            }
        } catch (SessionStartException e) {
            LOG.error("Auto-start failed: {}; use POST /start to retry", e.getMessage());
        }
    }
}
