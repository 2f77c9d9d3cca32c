/**
 * Live audio input: device enumeration, Java Sound streams and fixed-length sample recording.
 */
package com.phillippitts.vinylscrobbler.service.audio.capture;
