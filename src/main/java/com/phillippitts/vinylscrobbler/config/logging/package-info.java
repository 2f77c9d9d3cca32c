/**
 * Request-scoped logging context for the REST surface.
 */
package com.phillippitts.vinylscrobbler.config.logging;
