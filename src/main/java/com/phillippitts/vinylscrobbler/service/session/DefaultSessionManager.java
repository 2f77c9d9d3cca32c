package com.phillippitts.vinylscrobbler.service.session;

import com.phillippitts.vinylscrobbler.config.properties.AudioCaptureProperties;
import com.phillippitts.vinylscrobbler.config.properties.SessionProperties;
import com.phillippitts.vinylscrobbler.domain.SessionStatus;
import com.phillippitts.vinylscrobbler.exception.AudioDeviceException;
import com.phillippitts.vinylscrobbler.exception.FatalSessionException;
import com.phillippitts.vinylscrobbler.exception.SessionStartException;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioDevice;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioDeviceCatalog;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioSource;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioStream;
import com.phillippitts.vinylscrobbler.service.session.event.SessionErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default implementation of {@link SessionManager}: one run loop on the session executor,
 * driving a {@link DetectionCycle} against an exclusively opened {@link AudioStream}.
 *
 * <p><b>Lock discipline:</b>
 * <ul>
 *   <li>{@code lifecycleLock} serializes {@link #start(Integer)} and {@link #stop()}; the run loop never takes it</li>
 *   <li>{@code statusLock} guards the published {@link SessionStatus} and the Idle/Running transition,
 *       so a stale loop cannot publish after its session ended</li>
 * </ul>
 *
 * <p><b>Cancellation:</b> stop clears the session's active flag and interrupts the loop thread.
 * The interrupt aborts pacing sleeps, cancels an in-flight recognition call and is checked between
 * audio chunks and consistency samples. The stream is closed in the loop's {@code finally} block.
 * A loop that outlives {@code session.stop-timeout-ms} keeps the session claimed until it exits:
 * status reports not running, but {@link #start(Integer)} is refused while the device is held.
 *
 * <p><b>Errors:</b> audio device errors skip the cycle and reopen the device; more than
 * {@code max-reopen-attempts} in a row end the session. Other cycle failures back off and retry,
 * up to {@value #MAX_CONSECUTIVE_CYCLE_FAILURES} in a row. A fatal error stops the session, clears
 * the current track and notifies listeners.
 */
public class DefaultSessionManager implements SessionManager {

    private static final Logger LOG = LogManager.getLogger(DefaultSessionManager.class);

    static final int MAX_CONSECUTIVE_CYCLE_FAILURES = 5;

    private final AudioSource audioSource;
    private final DetectionCycle cycle;
    private final ListenerRegistry listeners;
    private final AudioDeviceCatalog catalog;
    private final AudioCaptureProperties captureProps;
    private final SessionProperties sessionProps;
    private final AsyncTaskExecutor sessionExecutor;
    private final ApplicationEventPublisher events;

    private final SessionStateMachine stateMachine = new SessionStateMachine();
    private final Lock lifecycleLock = new ReentrantLock();
    private final Object statusLock = new Object();

    private volatile SessionStatus status = SessionStatus.idle();
    private volatile String lastFatalError;

    // Guarded by lifecycleLock
    private SessionRun current;

    public DefaultSessionManager(AudioSource audioSource,
                                 DetectionCycle cycle,
                                 ListenerRegistry listeners,
                                 AudioDeviceCatalog catalog,
                                 AudioCaptureProperties captureProps,
                                 SessionProperties sessionProps,
                                 AsyncTaskExecutor sessionExecutor,
                                 ApplicationEventPublisher events) {
        this.audioSource = Objects.requireNonNull(audioSource, "audioSource must not be null");
        this.cycle = Objects.requireNonNull(cycle, "cycle must not be null");
        this.listeners = Objects.requireNonNull(listeners, "listeners must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.captureProps = Objects.requireNonNull(captureProps, "captureProps must not be null");
        this.sessionProps = Objects.requireNonNull(sessionProps, "sessionProps must not be null");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
    }

    @Override
    public boolean start(Integer deviceIndex) {
        lifecycleLock.lock();
        try {
            UUID id = UUID.randomUUID();
            if (!stateMachine.begin(id)) {
                SessionRun previous = current;
                if (previous != null && !previous.active) {
                    LOG.warn("Cannot start: session {} is still releasing the audio device", shortId(previous.id));
                    throw new SessionStartException("Previous session is still releasing the audio device");
                }
                LOG.warn("Cannot start: a session is already running (session={})",
                        shortId(stateMachine.getActiveSession()));
                return false;
            }
            Integer device = resolveDevice(deviceIndex);
            CycleState state = cycle.newState();
            SessionRun run = new SessionRun(id, device);
            SessionStatus started;
            synchronized (statusLock) {
                lastFatalError = null;
                started = new SessionStatus(true, device, null, state.activity().activity(), state.debug());
                status = started;
            }
            // Must precede anything the loop publishes
            listeners.publishStatus(started);
            try {
                run.future = sessionExecutor.submit(() -> runLoop(run, state));
            } catch (RejectedExecutionException e) {
                LOG.error("Could not schedule session loop: {}", e.getMessage());
                SessionStatus rejected;
                synchronized (statusLock) {
                    stateMachine.end(id);
                    rejected = new SessionStatus(false, device, null, started.activity(),
                            started.debug().withLastError("Could not schedule session loop"));
                    status = rejected;
                }
                listeners.publishStatus(rejected);
                throw new SessionStartException("Could not schedule session loop", e);
            }
            current = run;
            LOG.info("Session {} started on device {}", shortId(id), deviceLabel(device));
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public boolean stop() {
        lifecycleLock.lock();
        try {
            UUID id = stateMachine.getActiveSession();
            if (id == null) {
                LOG.info("Stop requested but no session is running");
                return false;
            }
            SessionRun run = current;
            if (run != null && run.id.equals(id) && !run.active) {
                LOG.info("Stop requested but session {} is already stopping", shortId(id));
                return false;
            }
            boolean exited = run == null || !run.id.equals(id) || cancelAndAwait(run);
            SessionStatus stopped;
            synchronized (statusLock) {
                if (exited) {
                    stateMachine.end(id);
                }
                SessionStatus s = status;
                stopped = new SessionStatus(false, s.currentDevice(), null, s.activity(), s.debug());
                status = stopped;
            }
            if (exited) {
                current = null;
            }
            listeners.publishTrack(null);
            listeners.publishStatus(stopped);
            LOG.info("Session {} stopped", shortId(id));
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        if (stateMachine.isActive()) {
            LOG.info("Shutting down with an active session; stopping it");
            stop();
        }
    }

    @Override
    public SessionStatus status() {
        return status;
    }

    @Override
    public boolean isRunning() {
        return status.running();
    }

    @Override
    public Optional<String> lastFatalError() {
        return Optional.ofNullable(lastFatalError);
    }

    @Override
    public ListenerRegistration addTrackListener(TrackListener listener) {
        return listeners.addTrackListener(listener);
    }

    @Override
    public ListenerRegistration addStatusListener(StatusListener listener) {
        return listeners.addStatusListener(listener);
    }

    private Integer resolveDevice(Integer requested) {
        if (requested != null) {
            return requested;
        }
        if (captureProps.getDeviceIndex() != null) {
            return captureProps.getDeviceIndex();
        }
        return catalog.defaultDevice().map(AudioDevice::index).orElse(null);
    }

    /**
     * Stops the loop and waits up to the stop timeout.
     *
     * @return true once nothing of the loop holds the device any more
     */
    private boolean cancelAndAwait(SessionRun run) {
        boolean started;
        synchronized (run) {
            run.active = false;
            started = run.thread != null;
            if (started) {
                run.thread.interrupt();
            }
        }
        if (!started) {
            // Not picked up yet; the loop sees active=false and returns if it does start
            if (run.future != null) {
                run.future.cancel(false);
            }
            return true;
        }
        try {
            if (run.exited.await(sessionProps.getStopTimeoutMs(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            LOG.warn("Session loop did not exit within {} ms; the session stays claimed until it closes the device",
                    sessionProps.getStopTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the session loop to exit");
        }
        return false;
    }

    private void runLoop(SessionRun run, CycleState state) {
        synchronized (run) {
            if (!run.active) {
                run.exited.countDown();
                return;
            }
            run.thread = Thread.currentThread();
        }
        ThreadContext.put("sessionId", shortId(run.id));
        ThreadContext.put("device", deviceLabel(run.device));
        AudioStream stream = null;
        int deviceFailures = 0;
        int cycleFailures = 0;
        try {
            stream = openDevice(run, state);
            while (run.active && !Thread.currentThread().isInterrupted()) {
                try {
                    cycle.run(stream, state);
                    deviceFailures = 0;
                    cycleFailures = 0;
                    publish(run, state);
                    cycle.pause(state);
                } catch (AudioDeviceException e) {
                    deviceFailures++;
                    LOG.warn("Audio device error ({}/{}): {}", deviceFailures,
                            captureProps.getMaxReopenAttempts(), e.getMessage());
                    state.recordError(e.getMessage());
                    publishError(run, "DEVICE_" + e.getReason(), e.getMessage(), false);
                    publish(run, state);
                    closeQuietly(stream);
                    stream = null;
                    if (deviceFailures > captureProps.getMaxReopenAttempts()) {
                        throw new FatalSessionException(
                                "Audio device failed " + deviceFailures + " times in a row", e);
                    }
                    cycle.backoff();
                    stream = openDevice(run, state);
                } catch (FatalSessionException e) {
                    throw e;
                } catch (RuntimeException e) {
                    cycleFailures++;
                    LOG.warn("Detection cycle failed ({}/{}): {}", cycleFailures,
                            MAX_CONSECUTIVE_CYCLE_FAILURES, e.toString());
                    state.recordError(e.toString());
                    publishError(run, "CYCLE_ERROR", e.toString(), false);
                    publish(run, state);
                    if (cycleFailures >= MAX_CONSECUTIVE_CYCLE_FAILURES) {
                        throw new FatalSessionException(
                                "Detection failed " + cycleFailures + " cycles in a row", e);
                    }
                    cycle.backoff();
                }
            }
        } catch (InterruptedException e) {
            LOG.debug("Session loop interrupted");
        } catch (RuntimeException e) {
            fail(run, state, e);
        } finally {
            closeQuietly(stream);
            synchronized (run) {
                run.thread = null;
            }
            // Clear a pending stop interrupt before the pool thread is reused
            Thread.interrupted();
            release(run, state);
            LOG.info("Session loop exited");
            ThreadContext.clearAll();
            run.exited.countDown();
        }
    }

    /** Ends the session claim once the device is closed, unless stop or a fatal error already did. */
    private void release(SessionRun run, CycleState state) {
        SessionStatus ended;
        boolean hadTrack;
        synchronized (statusLock) {
            boolean wasActive = run.active;
            run.active = false;
            if (!stateMachine.end(run.id) || !wasActive) {
                return;
            }
            hadTrack = state.currentTrack() != null;
            ended = new SessionStatus(false, run.device, null, state.activity().activity(), state.debug());
            status = ended;
        }
        LOG.warn("Session {} loop ended without a stop request", shortId(run.id));
        if (hadTrack) {
            listeners.publishTrack(null);
        }
        listeners.publishStatus(ended);
    }

    private AudioStream openDevice(SessionRun run, CycleState state) throws InterruptedException {
        int attempts = captureProps.getMaxReopenAttempts();
        for (int attempt = 1; ; attempt++) {
            if (!run.active || Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Session stopping");
            }
            try {
                return audioSource.open(run.device);
            } catch (AudioDeviceException e) {
                LOG.warn("Opening audio device failed ({}/{}): {}", attempt, attempts, e.getMessage());
                state.recordError(e.getMessage());
                publishError(run, "DEVICE_" + e.getReason(), e.getMessage(), false);
                if (attempt >= attempts) {
                    throw new FatalSessionException("Audio device could not be opened after "
                            + attempts + " attempts", e);
                }
                cycle.backoff();
            }
        }
    }

    private void publish(SessionRun run, CycleState state) {
        SessionStatus snapshot;
        synchronized (statusLock) {
            if (!run.active || !stateMachine.isSessionActive(run.id)) {
                return;
            }
            snapshot = new SessionStatus(true, run.device, state.currentTrack(),
                    state.activity().activity(), state.debug());
            status = snapshot;
        }
        if (state.consumeTrackChanged()) {
            listeners.publishTrack(snapshot.currentTrack());
        }
        listeners.publishStatus(snapshot);
    }

    private void fail(SessionRun run, CycleState state, RuntimeException e) {
        String message = e.getMessage() == null ? e.toString() : e.getMessage();
        SessionStatus failed;
        boolean hadTrack;
        synchronized (statusLock) {
            boolean wasActive = run.active;
            run.active = false;
            if (!wasActive || !stateMachine.end(run.id)) {
                LOG.warn("Session ended with error after it was stopped: {}", message);
                return;
            }
            lastFatalError = message;
            hadTrack = state.currentTrack() != null;
            failed = new SessionStatus(false, run.device, null, state.activity().activity(),
                    state.debug().withLastError(message));
            status = failed;
        }
        LOG.error("Session {} stopped by fatal error: {}", shortId(run.id), message, e);
        if (hadTrack) {
            listeners.publishTrack(null);
        }
        listeners.publishStatus(failed);
        publishError(run, "FATAL", message, true);
    }

    private void publishError(SessionRun run, String reason, String detail, boolean fatal) {
        try {
            events.publishEvent(new SessionErrorEvent(shortId(run.id), reason, detail, fatal, Instant.now()));
        } catch (RuntimeException ex) {
            LOG.warn("Failed to publish session error event: {}", ex.toString());
        }
    }

    private static void closeQuietly(AudioStream stream) {
        if (stream == null) {
            return;
        }
        try {
            stream.close();
        } catch (RuntimeException e) {
            LOG.warn("Closing audio stream failed: {}", e.toString());
        }
    }

    private static String shortId(UUID id) {
        return id == null ? "none" : id.toString().substring(0, 8);
    }

    private static String deviceLabel(Integer device) {
        return device == null ? "default" : String.valueOf(device);
    }

    /** One session's loop bookkeeping; {@code thread} and {@code active} change under its monitor. */
    private static final class SessionRun {
        final UUID id;
        final Integer device;
        final CountDownLatch exited = new CountDownLatch(1);
        volatile boolean active = true;
        Thread thread;
        volatile Future<?> future;

        SessionRun(UUID id, Integer device) {
            this.id = id;
            this.device = device;
        }
    }
}
