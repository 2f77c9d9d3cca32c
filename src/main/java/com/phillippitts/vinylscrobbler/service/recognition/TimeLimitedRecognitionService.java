package com.phillippitts.vinylscrobbler.service.recognition;

import com.phillippitts.vinylscrobbler.exception.RecognitionException;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs recognition calls on a dedicated executor and bounds how long the caller waits.
 *
 * <p>On timeout, or when the waiting thread is interrupted (session stop), the in-flight call is
 * cancelled (its worker thread is interrupted) and a {@link RecognitionException} is thrown. Interruption is re-asserted on the
 * calling thread so the run loop notices the stop.
 */
public class TimeLimitedRecognitionService implements RecognitionService {

    private static final Logger LOG = LogManager.getLogger(TimeLimitedRecognitionService.class);

    private final RecognitionService delegate;
    private final AsyncTaskExecutor executor;
    private final long timeoutMs;

    public TimeLimitedRecognitionService(RecognitionService delegate, AsyncTaskExecutor executor, long timeoutMs) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Optional<RecognitionResult> identify(PcmBuffer sample) {
        Objects.requireNonNull(sample, "sample");
        Future<Optional<RecognitionResult>> future = executor.submit(() -> delegate.identify(sample));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            LOG.warn("Recognition by {} timed out after {} ms", delegate.getServiceName(), timeoutMs);
            throw new RecognitionException("Timed out after " + timeoutMs + " ms", delegate.getServiceName(), te);
        } catch (InterruptedException ie) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RecognitionException("Interrupted while waiting for recognition", delegate.getServiceName(), ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof RecognitionException re) {
                throw re;
            }
            throw new RecognitionException("Recognition failed: " + cause, delegate.getServiceName(), cause);
        }
    }

    @Override
    public String getServiceName() {
        return delegate.getServiceName();
    }

    long getTimeoutMs() {
        return timeoutMs;
    }
}
