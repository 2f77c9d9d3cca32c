package com.phillippitts.vinylscrobbler.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the recognition and scrobble executors (time-limited external
 * calls) and the listener executor (drains per-listener mailboxes).
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties recognition = new PoolProperties(2, 4, 8, "recognition-");
    private PoolProperties scrobble = new PoolProperties(1, 2, 4, "scrobble-");
    private PoolProperties listener = new PoolProperties(2, 4, 100, "listener-");

    public PoolProperties getRecognition() {
        return recognition;
    }

    public void setRecognition(PoolProperties recognition) {
        this.recognition = recognition;
    }

    public PoolProperties getScrobble() {
        return scrobble;
    }

    public void setScrobble(PoolProperties scrobble) {
        this.scrobble = scrobble;
    }

    public PoolProperties getListener() {
        return listener;
    }

    public void setListener(PoolProperties listener) {
        this.listener = listener;
    }

    /**
     * Sizing for one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
