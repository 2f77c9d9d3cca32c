package com.phillippitts.vinylscrobbler.service.session;

import com.phillippitts.vinylscrobbler.domain.SessionStatus;
import com.phillippitts.vinylscrobbler.domain.Track;
import com.phillippitts.vinylscrobbler.service.metrics.DetectionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fans session updates out to listeners without letting them block the run loop.
 *
 * <p>Every listener owns a bounded mailbox. Publishing only enqueues; a drain task on the listener
 * executor delivers queued updates in order, one drain per mailbox at a time. When a mailbox is
 * full the update is dropped for that listener, logged at WARN and counted. Exceptions thrown by
 * a listener are logged and never reach the session.
 */
public class ListenerRegistry {

    private static final Logger LOG = LogManager.getLogger(ListenerRegistry.class);

    private final Executor executor;
    private final int capacity;
    private final DetectionMetrics metrics;

    private final CopyOnWriteArrayList<Mailbox<Optional<Track>>> trackMailboxes = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Mailbox<SessionStatus>> statusMailboxes = new CopyOnWriteArrayList<>();

    public ListenerRegistry(Executor executor, int capacity, DetectionMetrics metrics) {
        this.executor = Objects.requireNonNull(executor, "executor");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public ListenerRegistration addTrackListener(TrackListener listener) {
        Objects.requireNonNull(listener, "listener");
        Mailbox<Optional<Track>> box = new Mailbox<>("track", t -> listener.onTrackChanged(t.orElse(null)));
        trackMailboxes.add(box);
        return () -> trackMailboxes.remove(box);
    }

    public ListenerRegistration addStatusListener(StatusListener listener) {
        Objects.requireNonNull(listener, "listener");
        Mailbox<SessionStatus> box = new Mailbox<>("status", listener::onStatusChanged);
        statusMailboxes.add(box);
        return () -> statusMailboxes.remove(box);
    }

    /** Queues a track change for every track listener. */
    public void publishTrack(Track track) {
        Optional<Track> update = Optional.ofNullable(track);
        for (Mailbox<Optional<Track>> box : trackMailboxes) {
            box.offer(update);
        }
    }

    /** Queues a status snapshot for every status listener. */
    public void publishStatus(SessionStatus status) {
        Objects.requireNonNull(status, "status");
        for (Mailbox<SessionStatus> box : statusMailboxes) {
            box.offer(status);
        }
    }

    int listenerCount() {
        return trackMailboxes.size() + statusMailboxes.size();
    }

    private final class Mailbox<T> {
        private final String kind;
        private final Consumer<T> deliver;
        private final BlockingQueue<T> queue = new ArrayBlockingQueue<>(capacity);
        private final AtomicBoolean draining = new AtomicBoolean(false);

        Mailbox(String kind, Consumer<T> deliver) {
            this.kind = kind;
            this.deliver = deliver;
        }

        void offer(T update) {
            if (!queue.offer(update)) {
                LOG.warn("{} listener mailbox full ({}); dropping update", kind, capacity);
                metrics.incrementListenerDropped(kind);
            }
            schedule();
        }

        private void schedule() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                // Spring's TaskRejectedException extends RejectedExecutionException
                draining.set(false);
                LOG.warn("{} listener delivery rejected; {} update(s) stay queued", kind, queue.size());
            }
        }

        private void drain() {
            try {
                T update;
                while ((update = queue.poll()) != null) {
                    try {
                        deliver.accept(update);
                    } catch (RuntimeException e) {
                        LOG.warn("{} listener threw; ignoring", kind, e);
                    }
                }
            } finally {
                draining.set(false);
            }
            if (!queue.isEmpty()) {
                schedule();
            }
        }
    }
}
