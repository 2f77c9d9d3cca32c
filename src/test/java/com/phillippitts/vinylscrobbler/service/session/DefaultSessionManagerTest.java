package com.phillippitts.vinylscrobbler.service.session;

import com.phillippitts.vinylscrobbler.config.ThreadPoolConfig;
import com.phillippitts.vinylscrobbler.config.properties.AudioCaptureProperties;
import com.phillippitts.vinylscrobbler.config.properties.SessionProperties;
import com.phillippitts.vinylscrobbler.config.properties.ThreadPoolProperties;
import com.phillippitts.vinylscrobbler.domain.Activity;
import com.phillippitts.vinylscrobbler.domain.SessionStatus;
import com.phillippitts.vinylscrobbler.domain.Track;
import com.phillippitts.vinylscrobbler.exception.AudioDeviceException;
import com.phillippitts.vinylscrobbler.exception.SessionStartException;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioDeviceCatalog;
import com.phillippitts.vinylscrobbler.service.scrobble.TimeLimitedScrobbleSink;
import com.phillippitts.vinylscrobbler.service.session.event.SessionErrorEvent;
import com.phillippitts.vinylscrobbler.testutil.EventCapturingPublisher;
import com.phillippitts.vinylscrobbler.testutil.SyncExecutor;
import com.phillippitts.vinylscrobbler.testutil.TestAudio;
import com.phillippitts.vinylscrobbler.testutil.TestPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DefaultSessionManagerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ThreadPoolTaskExecutor sessionExecutor =
            new ThreadPoolConfig(new ThreadPoolProperties()).sessionExecutor();
    private final EventCapturingPublisher events = new EventCapturingPublisher();
    private final List<Track> tracks = new CopyOnWriteArrayList<>();
    private final List<SessionStatus> statuses = new CopyOnWriteArrayList<>();
    private DefaultSessionManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.shutdown();
        }
        sessionExecutor.shutdown();
    }

    private DefaultSessionManager manager(TestPipeline p) {
        return manager(p, p.captureProps, new AudioDeviceCatalog(List::of));
    }

    private DefaultSessionManager manager(TestPipeline p, AudioCaptureProperties captureProps,
                                          AudioDeviceCatalog catalog) {
        return manager(p, p.cycle(), captureProps, catalog, 2_000, sessionExecutor);
    }

    private DefaultSessionManager manager(TestPipeline p, DetectionCycle cycle, int stopTimeoutMs) {
        return manager(p, cycle, p.captureProps, new AudioDeviceCatalog(List::of), stopTimeoutMs, sessionExecutor);
    }

    private DefaultSessionManager manager(TestPipeline p, DetectionCycle cycle, AudioCaptureProperties captureProps,
                                          AudioDeviceCatalog catalog, int stopTimeoutMs,
                                          AsyncTaskExecutor executor) {
        p.source.readDelay(5);
        ListenerRegistry listeners = new ListenerRegistry(new SyncExecutor(), 1_000, p.metrics);
        manager = new DefaultSessionManager(p.source, cycle, listeners, catalog, captureProps,
                new SessionProperties(1_000, stopTimeoutMs, false), executor, events);
        manager.addTrackListener(tracks::add);
        manager.addStatusListener(statuses::add);
        return manager;
    }

    private static SessionStatus last(List<SessionStatus> statuses) {
        return statuses.get(statuses.size() - 1);
    }

    @Test
    void detectsTrackAndClearsItOnStop() {
        TestPipeline p = new TestPipeline(TestAudio.LOUD);
        p.recognizer.otherwiseReturn("Can", "Vitamin C", 0.9);
        DefaultSessionManager mgr = manager(p);

        assertThat(mgr.start(null)).isTrue();
        await().atMost(TIMEOUT).until(() -> mgr.status().currentTrack() != null);

        assertThat(mgr.isRunning()).isTrue();
        assertThat(mgr.status().activity()).isEqualTo(Activity.ACTIVE);
        assertThat(mgr.stop()).isTrue();

        assertThat(mgr.isRunning()).isFalse();
        assertThat(mgr.status().currentTrack()).isNull();
        assertThat(p.sink.scrobbleCount()).isEqualTo(1);
        assertThat(tracks).hasSize(2);
        assertThat(tracks.get(0).title()).isEqualTo("Vitamin C");
        assertThat(tracks.get(1)).isNull();
        assertThat(last(statuses).running()).isFalse();
        assertThat(p.source.closes.get()).isEqualTo(p.source.opens.get());
    }

    @Test
    void firstStatusIsRunningWithoutTrack() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        DefaultSessionManager mgr = manager(p);

        mgr.start(3);

        assertThat(statuses.get(0).running()).isTrue();
        assertThat(statuses.get(0).currentDevice()).isEqualTo(3);
        assertThat(statuses.get(0).currentTrack()).isNull();
        assertThat(statuses.get(0).activity()).isEqualTo(Activity.STANDBY);
    }

    @Test
    void secondStartIsRefused() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        DefaultSessionManager mgr = manager(p);

        assertThat(mgr.start(null)).isTrue();
        assertThat(mgr.start(null)).isFalse();
        assertThat(mgr.stop()).isTrue();
        assertThat(mgr.stop()).isFalse();
        assertThat(p.source.opens.get()).isLessThanOrEqualTo(1);
    }

    @Test
    void stopWithoutSessionIsNoOp() {
        DefaultSessionManager mgr = manager(new TestPipeline(TestAudio.SILENT));

        assertThat(mgr.stop()).isFalse();
        assertThat(statuses).isEmpty();
        assertThat(tracks).isEmpty();
    }

    @Test
    void canRestartAfterStop() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        DefaultSessionManager mgr = manager(p);

        mgr.start(1);
        await().atMost(TIMEOUT).until(() -> p.source.reads.get() > 0);
        mgr.stop();
        assertThat(mgr.start(2)).isTrue();
        await().atMost(TIMEOUT).until(() -> p.source.opens.get() == 2);

        assertThat(p.source.openedDevices()).containsExactly(1, 2);
        assertThat(mgr.status().currentDevice()).isEqualTo(2);
    }

    @Test
    void silenceNeverReachesRecognizer() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        DefaultSessionManager mgr = manager(p);

        mgr.start(null);
        await().atMost(TIMEOUT).until(() -> p.source.reads.get() >= 10);
        mgr.stop();

        assertThat(p.recognizer.calls()).isZero();
        assertThat(p.sleeper.pauses()).contains(TestPipeline.STANDBY_POLL_MS);
        assertThat(p.sink.calls()).isEmpty();
    }

    @Test
    void configuredDeviceIsUsedWhenNoneRequested() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        AudioCaptureProperties withDevice = new AudioCaptureProperties(8_000, 1, 4_096, 1_000, 100, 5, 3);
        DefaultSessionManager mgr = manager(p, withDevice, new AudioDeviceCatalog(List::of));

        mgr.start(null);
        await().atMost(TIMEOUT).until(() -> p.source.opens.get() == 1);

        assertThat(p.source.openedDevices()).containsExactly(5);
        assertThat(mgr.status().currentDevice()).isEqualTo(5);
    }

    @Test
    void transientReadErrorReopensDevice() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        p.source.thenFail(AudioDeviceException.Reason.IO_ERROR);
        DefaultSessionManager mgr = manager(p);

        mgr.start(null);
        await().atMost(TIMEOUT).until(() -> p.source.opens.get() == 2 && p.source.reads.get() >= 3);

        assertThat(mgr.isRunning()).isTrue();
        assertThat(p.source.closes.get()).isEqualTo(1);
        assertThat(events.errorEvents()).extracting(SessionErrorEvent::reason).containsExactly("DEVICE_IO_ERROR");
        assertThat(events.hasFatalError()).isFalse();
        assertThat(p.sleeper.pauses()).contains(TestPipeline.BACKOFF_MS);
        assertThat(mgr.status().debug().lastError()).contains("IO_ERROR");
    }

    @Test
    void deviceThatCannotBeOpenedEndsSession() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        p.source.failOpens(3);
        DefaultSessionManager mgr = manager(p);

        mgr.start(null);
        await().atMost(TIMEOUT).until(() -> !mgr.isRunning());

        assertThat(mgr.lastFatalError()).hasValueSatisfying(m -> assertThat(m).contains("could not be opened"));
        assertThat(events.errorEvents()).extracting(SessionErrorEvent::reason)
                .containsExactly("DEVICE_UNAVAILABLE", "DEVICE_UNAVAILABLE", "DEVICE_UNAVAILABLE", "FATAL");
        assertThat(events.hasFatalError()).isTrue();
        assertThat(last(statuses).running()).isFalse();
        assertThat(mgr.stop()).isFalse();

        // The next start clears the fatal error
        assertThat(mgr.start(null)).isTrue();
        assertThat(mgr.lastFatalError()).isEmpty();
    }

    @Test
    void repeatedReadErrorsEndSessionAndReleaseDevice() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        for (int i = 0; i < 4; i++) {
            p.source.thenFail(AudioDeviceException.Reason.STREAM_CLOSED);
        }
        DefaultSessionManager mgr = manager(p);

        mgr.start(null);
        await().atMost(TIMEOUT).until(() -> !mgr.isRunning());

        assertThat(p.source.opens.get()).isEqualTo(4);
        await().atMost(TIMEOUT).until(() -> p.source.closes.get() == 4);
        assertThat(events.hasFatalError()).isTrue();
        assertThat(mgr.lastFatalError()).isPresent();
    }

    @Test
    void repeatedCycleFailuresEndSessionAndClearTrack() {
        TestPipeline p = new TestPipeline(TestAudio.LOUD);
        p.recognizer.thenReturn("Can", "Vitamin C", 0.9).thenReturn("Can", "Vitamin C", 0.9)
                .otherwiseThrow(new IllegalStateException("recognizer bug"));
        DefaultSessionManager mgr = manager(p);

        mgr.start(null);
        await().atMost(TIMEOUT).until(() -> !mgr.isRunning() && mgr.lastFatalError().isPresent());

        assertThat(events.errorEvents()).filteredOn(e -> "CYCLE_ERROR".equals(e.reason()))
                .hasSize(DefaultSessionManager.MAX_CONSECUTIVE_CYCLE_FAILURES);
        assertThat(mgr.status().currentTrack()).isNull();
        await().atMost(TIMEOUT).until(() -> !tracks.isEmpty() && tracks.get(tracks.size() - 1) == null);
        assertThat(tracks.get(0).title()).isEqualTo("Vitamin C");
    }

    @Test
    void stopInterruptsBlockingRead() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        DefaultSessionManager mgr = manager(p);
        p.source.readDelay(1_000);

        mgr.start(null);
        await().atMost(TIMEOUT).until(() -> p.source.reads.get() >= 1);
        long t0 = System.nanoTime();
        mgr.stop();
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        assertThat(elapsedMs).isLessThan(1_000);
        assertThat(p.source.closes.get()).isEqualTo(1);
    }

    @Test
    void stopIsNotHeldUpBySinkIgnoringInterrupts() {
        ThreadPoolTaskExecutor scrobbleExecutor = new ThreadPoolConfig(new ThreadPoolProperties()).scrobbleExecutor();
        try {
            TestPipeline p = new TestPipeline(TestAudio.LOUD);
            p.recognizer.otherwiseReturn("Can", "Vitamin C", 0.9);
            p.sink.stallOnce(3_000);
            DefaultSessionManager mgr = manager(p,
                    p.cycle(new TimeLimitedScrobbleSink(p.sink, scrobbleExecutor, 10_000)), 2_000);

            mgr.start(null);
            await().atMost(TIMEOUT).until(() -> p.sink.stalls() == 1);
            long t0 = System.nanoTime();
            assertThat(mgr.stop()).isTrue();
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

            assertThat(elapsedMs).isLessThan(1_500);
            assertThat(p.source.closes.get()).isEqualTo(p.source.opens.get());
            assertThat(mgr.start(null)).isTrue();
        } finally {
            scrobbleExecutor.shutdown();
        }
    }

    @Test
    void startIsRefusedWhileStoppedLoopStillHoldsDevice() {
        TestPipeline p = new TestPipeline(TestAudio.LOUD);
        p.recognizer.otherwiseReturn("Can", "Vitamin C", 0.9);
        p.sink.stallOnce(1_500);
        DefaultSessionManager mgr = manager(p, p.cycle(), 200);

        mgr.start(null);
        await().atMost(TIMEOUT).until(() -> p.sink.stalls() == 1);
        assertThat(mgr.stop()).isTrue();

        assertThat(mgr.isRunning()).isFalse();
        assertThat(last(statuses).running()).isFalse();
        assertThat(p.source.closes.get()).isZero();
        assertThatThrownBy(() -> mgr.start(null))
                .isInstanceOf(SessionStartException.class)
                .hasMessageContaining("still releasing");
        assertThat(mgr.stop()).isFalse();
        assertThat(p.source.opens.get()).isEqualTo(1);

        await().atMost(TIMEOUT).until(() -> p.source.closes.get() == 1);
        await().atMost(TIMEOUT).ignoreException(SessionStartException.class).until(() -> mgr.start(null));
        await().atMost(TIMEOUT).until(() -> p.source.opens.get() == 2);
        assertThat(mgr.isRunning()).isTrue();
    }

    @Test
    void startThatCannotBeScheduledThrowsAndStaysIdle() {
        ThreadPoolTaskExecutor rejecting = new ThreadPoolConfig(new ThreadPoolProperties()).sessionExecutor();
        rejecting.shutdown();
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        DefaultSessionManager mgr = manager(p, p.cycle(), p.captureProps, new AudioDeviceCatalog(List::of),
                2_000, rejecting);

        assertThatThrownBy(() -> mgr.start(null))
                .isInstanceOf(SessionStartException.class)
                .hasMessageContaining("Could not schedule");

        assertThat(mgr.isRunning()).isFalse();
        assertThat(last(statuses).running()).isFalse();
        assertThat(last(statuses).debug().lastError()).isEqualTo("Could not schedule session loop");
        assertThat(mgr.stop()).isFalse();
        assertThat(p.source.opens.get()).isZero();
    }

    @Test
    void shutdownStopsRunningSession() {
        TestPipeline p = new TestPipeline(TestAudio.SILENT);
        DefaultSessionManager mgr = manager(p);
        mgr.start(null);

        mgr.shutdown();

        assertThat(mgr.isRunning()).isFalse();
    }
}
