package com.phillippitts.vinylscrobbler.service.session;

import com.phillippitts.vinylscrobbler.domain.SessionStatus;

/**
 * Receives a status snapshot after every detection cycle and on start/stop.
 */
@FunctionalInterface
public interface StatusListener {

    void onStatusChanged(SessionStatus status);
}
