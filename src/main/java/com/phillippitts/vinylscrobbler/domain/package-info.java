/**
 * Immutable domain model shared by the detection pipeline and its listeners.
 *
 * <p>{@link com.phillippitts.vinylscrobbler.domain.Track} and
 * {@link com.phillippitts.vinylscrobbler.domain.TrackKey} carry identification results;
 * {@link com.phillippitts.vinylscrobbler.domain.SessionStatus} is the snapshot handed to
 * listeners and REST clients.
 *
 * @since 1.0
 */
package com.phillippitts.vinylscrobbler.domain;
