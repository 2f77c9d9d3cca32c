/**
 * Reporting identified tracks: the {@link com.phillippitts.vinylscrobbler.service.scrobble.ScrobbleSink}
 * contract, its Last.fm and logging implementations, and the deduplicator deciding when to call them.
 */
package com.phillippitts.vinylscrobbler.service.scrobble;
