package com.phillippitts.vinylscrobbler.util;

/**
 * Pacing abstraction for the run loop, so tests can run without real delays.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeper backed by {@link Thread#sleep(long)}. */
    Sleeper SYSTEM = millis -> {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    /**
     * Pauses the calling thread.
     *
     * @throws InterruptedException if interrupted while paused
     */
    void sleep(long millis) throws InterruptedException;
}
