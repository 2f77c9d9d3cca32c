/**
 * Spring wiring for the detection pipeline and the listening session.
 */
package com.phillippitts.vinylscrobbler.config.session;
