package com.phillippitts.vinylscrobbler.service.health;

import com.phillippitts.vinylscrobbler.domain.SessionStatus;
import com.phillippitts.vinylscrobbler.service.session.SessionManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Health of the listening session.
 *
 * <ul>
 *   <li>UP: a session is running, or none was started</li>
 *   <li>DOWN: the last session ended with a fatal error (until the next successful start)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SessionHealthIndicator implements HealthIndicator {

    private final SessionManager sessionManager;

    public SessionHealthIndicator(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public Health health() {
        SessionStatus status = sessionManager.status();
        Optional<String> fatal = sessionManager.lastFatalError();

        Health.Builder builder = (!status.running() && fatal.isPresent()) ? Health.down() : Health.up();
        builder.withDetail("running", status.running())
                .withDetail("device", status.device().map(String::valueOf).orElse("none"))
                .withDetail("activity", status.activity().name());
        fatal.ifPresent(msg -> builder.withDetail("lastError", msg));
        return builder.build();
    }
}
