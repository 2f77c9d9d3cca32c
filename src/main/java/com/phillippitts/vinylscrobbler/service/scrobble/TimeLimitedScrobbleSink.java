package com.phillippitts.vinylscrobbler.service.scrobble;

import com.phillippitts.vinylscrobbler.exception.ScrobbleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs sink calls on a dedicated executor and bounds how long the run loop waits for them.
 *
 * <p>On timeout, or when the waiting thread is interrupted (session stop), the in-flight call is
 * cancelled and a {@link ScrobbleException} is thrown, so the deduplicator keeps its anchor and the
 * report is retried. Interruption is re-asserted on the calling thread. A sink that ignores the
 * interrupt keeps its worker thread busy, never the run loop.
 */
public class TimeLimitedScrobbleSink implements ScrobbleSink {

    private static final Logger LOG = LogManager.getLogger(TimeLimitedScrobbleSink.class);

    private final ScrobbleSink delegate;
    private final AsyncTaskExecutor executor;
    private final long timeoutMs;

    public TimeLimitedScrobbleSink(ScrobbleSink delegate, AsyncTaskExecutor executor, long timeoutMs) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void updateNowPlaying(String artist, String title) {
        call("now_playing", () -> delegate.updateNowPlaying(artist, title));
    }

    @Override
    public void scrobble(String artist, String title, Instant timestamp) {
        call("scrobble", () -> delegate.scrobble(artist, title, timestamp));
    }

    @Override
    public void clearNowPlaying() {
        call("clear", delegate::clearNowPlaying);
    }

    @Override
    public String getSinkName() {
        return delegate.getSinkName();
    }

    long getTimeoutMs() {
        return timeoutMs;
    }

    private void call(String operation, Runnable action) {
        Future<?> future;
        try {
            future = executor.submit(action);
        } catch (RejectedExecutionException e) {
            throw new ScrobbleException(operation, "no worker available for " + delegate.getSinkName(), e);
        }
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            LOG.warn("{} call to {} timed out after {} ms", operation, delegate.getSinkName(), timeoutMs);
            throw new ScrobbleException(operation, "Timed out after " + timeoutMs + " ms", te);
        } catch (InterruptedException ie) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScrobbleException(operation, "Interrupted while waiting for " + delegate.getSinkName(), ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof ScrobbleException se) {
                throw se;
            }
            throw new ScrobbleException(operation, String.valueOf(cause), cause);
        }
    }
}
