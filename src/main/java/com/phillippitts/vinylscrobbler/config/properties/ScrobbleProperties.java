package com.phillippitts.vinylscrobbler.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for scrobble targets.
 *
 * <p>When {@code scrobble.lastfm.enabled} is false or credentials are missing, reports are only logged.
 */
@Validated
@ConfigurationProperties(prefix = "scrobble")
public class ScrobbleProperties {

    @Valid
    private LastFm lastfm = new LastFm();

    /** Upper bound on one sink call, including a Last.fm re-authentication. */
    @Min(500)
    @Max(120_000)
    private int callTimeoutMs = 25_000;

    public int getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(int callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }

    public LastFm getLastfm() {
        return lastfm;
    }

    public void setLastfm(LastFm lastfm) {
        this.lastfm = lastfm;
    }

    /**
     * Last.fm API credentials. The password is exchanged for a session key on first use.
     */
    public static class LastFm {
        private boolean enabled = false;
        private String apiUrl = "https://ws.audioscrobbler.com/2.0/";
        private String apiKey;
        private String apiSecret;
        private String username;
        private String password;
        @Min(500)
        @Max(60_000)
        private int timeoutMs = 10_000;

        /** True when enabled and every credential is present. */
        public boolean isConfigured() {
            return enabled && notBlank(apiKey) && notBlank(apiSecret)
                    && notBlank(username) && notBlank(password);
        }

        private static boolean notBlank(String s) {
            return s != null && !s.isBlank();
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiUrl() {
            return apiUrl;
        }

        public void setApiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiSecret() {
            return apiSecret;
        }

        public void setApiSecret(String apiSecret) {
            this.apiSecret = apiSecret;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
