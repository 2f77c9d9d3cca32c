/**
 * Audio primitives: the mono PCM16LE {@link com.phillippitts.vinylscrobbler.service.audio.PcmBuffer},
 * format constants and WAV encoding. Device access lives in the {@code capture} sub-package.
 *
 * @since 1.0
 */
package com.phillippitts.vinylscrobbler.service.audio;
