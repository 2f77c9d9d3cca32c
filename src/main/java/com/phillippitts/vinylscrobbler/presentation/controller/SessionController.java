package com.phillippitts.vinylscrobbler.presentation.controller;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.phillippitts.vinylscrobbler.domain.DebugInfo;
import com.phillippitts.vinylscrobbler.domain.SessionStatus;
import com.phillippitts.vinylscrobbler.domain.Track;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioDevice;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioDeviceCatalog;
import com.phillippitts.vinylscrobbler.service.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Thin control surface over the {@link SessionManager}: list devices, read status, start and stop.
 *
 * <p>Start and stop always answer 200; the body says whether anything changed
 * ({@code started}/{@code already_running}, {@code stopped}/{@code not_running}). A start the
 * session manager cannot carry out raises {@code SessionStartException}, answered with 503.
 */
@RestController
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final SessionManager sessionManager;
    private final AudioDeviceCatalog catalog;

    SessionController(SessionManager sessionManager, AudioDeviceCatalog catalog) {
        this.sessionManager = sessionManager;
        this.catalog = catalog;
    }

    @GetMapping("/devices")
    List<AudioDevice> devices() {
        return catalog.listInputDevices();
    }

    @GetMapping("/status")
    StatusView status() {
        return StatusView.of(sessionManager.status());
    }

    @PostMapping("/start")
    ResponseEntity<Map<String, String>> start(@RequestBody(required = false) StartRequest request) {
        Integer device = request == null ? null : request.deviceIndex();
        LOG.info("Start requested (device={})", device == null ? "auto" : device);
        boolean started = sessionManager.start(device);
        return ResponseEntity.ok(Map.of("status", started ? "started" : "already_running"));
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, String>> stop() {
        LOG.info("Stop requested");
        boolean stopped = sessionManager.stop();
        return ResponseEntity.ok(Map.of("status", stopped ? "stopped" : "not_running"));
    }

    /**
     * Body of {@code POST /start}; accepts {@code deviceIndex} or {@code device_index}.
     */
    record StartRequest(@JsonAlias("device_index") Integer deviceIndex) {}

    record TrackView(String artist, String title, double confidence, Instant detectedAt) {
        static TrackView of(Track t) {
            return t == null ? null : new TrackView(t.artist(), t.title(), t.confidence(), t.detectedAt());
        }
    }

    record StatusView(boolean running,
                      Integer deviceIndex,
                      TrackView currentTrack,
                      String activity,
                      DebugInfo debug) {
        static StatusView of(SessionStatus s) {
            return new StatusView(s.running(), s.currentDevice(), TrackView.of(s.currentTrack()),
                    s.activity().name(), s.debug());
        }
    }
}
