package com.phillippitts.vinylscrobbler.config;

import com.phillippitts.vinylscrobbler.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind a listening session.
 *
 * <p>Four executors exist:
 * <ul>
 *   <li>{@code sessionExecutor} - a single thread owning the run loop; at most one loop runs</li>
 *   <li>{@code recognitionExecutor} - runs recognition calls so they can be time-limited and cancelled</li>
 *   <li>{@code scrobbleExecutor} - runs now-playing and scrobble calls under the same time limit</li>
 *   <li>{@code listenerExecutor} - drains per-listener mailboxes off the run loop</li>
 * </ul>
 *
 * <p>All executors copy the Log4j2 ThreadContext (MDC) of the submitting thread so session
 * identifiers appear in logs emitted from worker threads.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Single-thread executor for the detection run loop.
     *
     * <p>The session manager guarantees single-flight; the pool size of one makes a second loop
     * impossible even if that guarantee were broken.
     *
     * @return executor for the run loop
     */
    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("session-loop-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Bounded pool for recognition calls.
     *
     * <p>Calls are sequential per session, but a timed-out call may still be unwinding while the
     * next one starts, so more than one thread is kept. Rejection policy is
     * {@link ThreadPoolExecutor.CallerRunsPolicy}: under saturation the run loop performs the call itself.
     *
     * @return executor for recognition calls
     */
    @Bean(name = "recognitionExecutor")
    public ThreadPoolTaskExecutor recognitionExecutor() {
        return build(threadPoolProperties.getRecognition(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Bounded pool for scrobble sink calls.
     *
     * <p>Rejection policy is {@link ThreadPoolExecutor.AbortPolicy}: a saturated pool (sink calls
     * stuck past their timeout) fails the report instead of blocking the run loop.
     *
     * @return executor for scrobble sink calls
     */
    @Bean(name = "scrobbleExecutor")
    public ThreadPoolTaskExecutor scrobbleExecutor() {
        return build(threadPoolProperties.getScrobble(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Bounded pool draining listener mailboxes.
     *
     * <p>Rejection policy is {@link ThreadPoolExecutor.AbortPolicy}; the listener registry treats a
     * rejected drain as a delivery failure and retries on the next update.
     *
     * @return executor for listener delivery
     */
    @Bean(name = "listenerExecutor")
    public ThreadPoolTaskExecutor listenerExecutor() {
        return build(threadPoolProperties.getListener(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
