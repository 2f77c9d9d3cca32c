package com.phillippitts.vinylscrobbler.service.session;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe Idle/Running state for listening sessions.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → RUNNING (via begin)
 * RUNNING → IDLE (via end, by the owning session only)
 * </pre>
 *
 * <p>At most one session is active; a second {@link #begin(UUID)} is refused rather than queued.
 */
public final class SessionStateMachine {

    private final Lock lock = new ReentrantLock();
    private UUID activeSession;

    /**
     * Attempts to make {@code sessionId} the active session.
     *
     * @return {@code true} if it is now active, {@code false} if another session already was
     */
    public boolean begin(UUID sessionId) {
        Objects.requireNonNull(sessionId, "sessionId cannot be null");
        lock.lock();
        try {
            if (activeSession != null) {
                return false;
            }
            activeSession = sessionId;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the session if it is the active one.
     *
     * @return {@code true} if it was active and is now ended
     */
    public boolean end(UUID expectedSessionId) {
        lock.lock();
        try {
            if (activeSession == null || !activeSession.equals(expectedSessionId)) {
                return false;
            }
            activeSession = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return active session ID, or {@code null} when idle
     */
    public UUID getActiveSession() {
        lock.lock();
        try {
            return activeSession;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive() {
        return getActiveSession() != null;
    }

    public boolean isSessionActive(UUID sessionId) {
        return sessionId != null && sessionId.equals(getActiveSession());
    }
}
