package com.phillippitts.vinylscrobbler.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the external recognition service.
 */
@Validated
@ConfigurationProperties(prefix = "recognition")
public class RecognitionProperties {

    /** Endpoint accepting a multipart WAV upload and returning AudD-style JSON. */
    @NotBlank
    private final String endpoint;

    /** API token sent with every request; blank disables authentication. */
    private final String apiToken;

    /** Hard limit for a single recognition call, including upload. */
    @Min(1_000)
    @Max(120_000)
    private final int timeoutMs;

    @Min(100)
    @Max(60_000)
    private final int connectTimeoutMs;

    @ConstructorBinding
    public RecognitionProperties(String endpoint, String apiToken, Integer timeoutMs, Integer connectTimeoutMs) {
        this.endpoint = (endpoint == null || endpoint.isBlank()) ? "https://api.audd.io/" : endpoint;
        this.apiToken = (apiToken == null || apiToken.isBlank()) ? null : apiToken;
        this.timeoutMs = timeoutMs == null ? 15_000 : timeoutMs;
        this.connectTimeoutMs = connectTimeoutMs == null ? 5_000 : connectTimeoutMs;
    }

    public String getEndpoint() { return endpoint; }
    public String getApiToken() { return apiToken; }
    public int getTimeoutMs() { return timeoutMs; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
}
