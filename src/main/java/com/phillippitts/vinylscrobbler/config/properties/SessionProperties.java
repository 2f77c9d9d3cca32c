package com.phillippitts.vinylscrobbler.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the session lifecycle and listener fan-out.
 */
@Validated
@ConfigurationProperties(prefix = "session")
public class SessionProperties {

    /** Pending updates buffered per listener before new ones are dropped. */
    @Min(1)
    @Max(10_000)
    private final int listenerQueueCapacity;

    /** How long stop waits for the run loop to exit. */
    @Min(100)
    @Max(120_000)
    private final int stopTimeoutMs;

    /** Start a session when the application is ready. */
    private final boolean autoStart;

    @ConstructorBinding
    public SessionProperties(Integer listenerQueueCapacity, Integer stopTimeoutMs, Boolean autoStart) {
        this.listenerQueueCapacity = listenerQueueCapacity == null ? 32 : listenerQueueCapacity;
        this.stopTimeoutMs = stopTimeoutMs == null ? 5_000 : stopTimeoutMs;
        this.autoStart = autoStart != null && autoStart;
    }

    public static SessionProperties defaults() {
        return new SessionProperties(null, null, null);
    }

    public int getListenerQueueCapacity() { return listenerQueueCapacity; }
    public int getStopTimeoutMs() { return stopTimeoutMs; }
    public boolean isAutoStart() { return autoStart; }
}
