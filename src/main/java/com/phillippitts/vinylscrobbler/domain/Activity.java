package com.phillippitts.vinylscrobbler.domain;

/**
 * Audio activity classification produced by the level monitor.
 *
 * <p>{@link #STANDBY} suppresses recognition entirely; only loudness probes run.
 */
public enum Activity {
    ACTIVE,
    STANDBY
}
