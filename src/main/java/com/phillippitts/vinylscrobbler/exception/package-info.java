/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.vinylscrobbler.exception.VinylScrobblerException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.vinylscrobbler.exception.AudioDeviceException} - Audio input
 *       closed, failing or unavailable; recovered by reopening within a bounded budget</li>
 *   <li>{@link com.phillippitts.vinylscrobbler.exception.RecognitionException} - Recognition call
 *       failed or timed out; counts as a sample without result</li>
 *   <li>{@link com.phillippitts.vinylscrobbler.exception.ScrobbleException} - Now-playing or
 *       scrobble submission failed; dedup state preserved for retry</li>
 *   <li>{@link com.phillippitts.vinylscrobbler.exception.FatalSessionException} - Run loop cannot
 *       continue; the session stops</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and map to HTTP status
 * codes through {@code GlobalExceptionHandler} when they reach the REST boundary.
 *
 * @see com.phillippitts.vinylscrobbler.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.vinylscrobbler.exception;
