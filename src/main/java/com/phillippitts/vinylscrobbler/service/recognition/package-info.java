/**
 * Track recognition: the external {@link com.phillippitts.vinylscrobbler.service.recognition.RecognitionService}
 * contract with its HTTP adapter and timeout decorator, plus the majority vote
 * ({@link com.phillippitts.vinylscrobbler.service.recognition.ConsistencyChecker}) and the
 * {@link com.phillippitts.vinylscrobbler.service.recognition.AggressiveFallback} burst built on it.
 */
package com.phillippitts.vinylscrobbler.service.recognition;
