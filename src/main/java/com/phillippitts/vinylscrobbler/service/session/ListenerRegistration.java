package com.phillippitts.vinylscrobbler.service.session;

/**
 * Handle returned when a listener is added; removing it stops further deliveries.
 */
@FunctionalInterface
public interface ListenerRegistration {

    void remove();
}
