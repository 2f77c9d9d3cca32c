package com.phillippitts.vinylscrobbler.presentation.controller;

import com.phillippitts.vinylscrobbler.presentation.controller.SessionController.StatusView;
import com.phillippitts.vinylscrobbler.presentation.controller.SessionController.TrackView;
import com.phillippitts.vinylscrobbler.service.session.ListenerRegistration;
import com.phillippitts.vinylscrobbler.service.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pushes session updates to browsers as server-sent events on {@code GET /events}.
 *
 * <p>Each client gets its own track and status listener on the {@link SessionManager}, so a slow
 * client only fills its own mailboxes. Both listeners are removed when the client disconnects,
 * the stream errors or a send fails. The current status is sent as soon as the stream opens.
 *
 * <p>Events: {@code status_update} carries the same body as {@code GET /status};
 * {@code track_update} carries {@code {"currentTrack": ...}}, with null when the track was cleared.
 */
@RestController
class SessionEventsController {

    private static final Logger LOG = LogManager.getLogger(SessionEventsController.class);

    static final String STATUS_EVENT = "status_update";
    static final String TRACK_EVENT = "track_update";

    // Streams stay open until the client goes away
    private static final long NO_TIMEOUT = 0L;

    private final SessionManager sessionManager;
    private final AtomicInteger clients = new AtomicInteger();

    SessionEventsController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter events() {
        return subscribe(new SseEmitter(NO_TIMEOUT));
    }

    SseEmitter subscribe(SseEmitter emitter) {
        Subscription subscription = new Subscription(emitter);
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());
        subscription.open();
        return emitter;
    }

    int clientCount() {
        return clients.get();
    }

    /** Body of a {@code track_update} event. */
    record TrackUpdate(TrackView currentTrack) {}

    private final class Subscription {
        private final SseEmitter emitter;
        private final List<ListenerRegistration> registrations = new ArrayList<>();
        private boolean closed;

        Subscription(SseEmitter emitter) {
            this.emitter = emitter;
        }

        synchronized void open() {
            clients.incrementAndGet();
            send(STATUS_EVENT, StatusView.of(sessionManager.status()));
            if (closed) {
                return;
            }
            registrations.add(sessionManager.addStatusListener(s -> send(STATUS_EVENT, StatusView.of(s))));
            registrations.add(sessionManager.addTrackListener(t -> send(TRACK_EVENT, new TrackUpdate(TrackView.of(t)))));
            LOG.info("Event stream client connected ({} open)", clients.get());
        }

        synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            registrations.forEach(ListenerRegistration::remove);
            registrations.clear();
            LOG.info("Event stream client disconnected ({} open)", clients.decrementAndGet());
        }

        private void send(String name, Object data) {
            try {
                emitter.send(SseEmitter.event().name(name).data(data, MediaType.APPLICATION_JSON));
            } catch (IOException | IllegalStateException e) {
                // The container completes the emitter
                LOG.debug("Event stream send failed; dropping client: {}", e.toString());
                close();
            }
        }
    }
}
