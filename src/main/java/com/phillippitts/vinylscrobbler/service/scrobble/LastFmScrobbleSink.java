package com.phillippitts.vinylscrobbler.service.scrobble;

import com.phillippitts.vinylscrobbler.config.properties.ScrobbleProperties;
import com.phillippitts.vinylscrobbler.exception.ScrobbleException;
import com.phillippitts.vinylscrobbler.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.DigestUtils;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Last.fm 2.0 scrobbling API client.
 *
 * <p>Authenticates lazily with {@code auth.getMobileSession} and caches the session key. Every
 * write call is signed: {@code api_sig} is the md5 of all parameters (except {@code format})
 * sorted by name and concatenated as name+value, followed by the shared secret.
 *
 * <p>Last.fm reports failures as {@code {"error": code, "message": "..."}}, sometimes with HTTP 200.
 * An invalid session key (error 9) drops the cached key so the next call re-authenticates.
 *
 * <p>Last.fm has no call to withdraw now-playing; {@link #clearNowPlaying()} is a no-op and the
 * status expires on its own.
 */
public class LastFmScrobbleSink implements ScrobbleSink {

    private static final Logger LOG = LogManager.getLogger(LastFmScrobbleSink.class);

    static final int ERROR_INVALID_SESSION_KEY = 9;

    private final RestTemplate restTemplate;
    private final ScrobbleProperties.LastFm props;

    private final Object sessionLock = new Object();
    private volatile String sessionKey;

    public LastFmScrobbleSink(RestTemplate restTemplate, ScrobbleProperties.LastFm props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.props = Objects.requireNonNull(props, "props");
        if (!props.isConfigured()) {
            throw new IllegalArgumentException("Last.fm api-key, api-secret, username and password are required");
        }
    }

    @Override
    public void updateNowPlaying(String artist, String title) {
        Map<String, String> params = new TreeMap<>();
        params.put("method", "track.updateNowPlaying");
        params.put("artist", artist);
        params.put("track", title);
        callAuthenticated("track.updateNowPlaying", params);
        LOG.info("Last.fm now playing: {}", LogSanitizer.track(artist, title));
    }

    @Override
    public void scrobble(String artist, String title, Instant timestamp) {
        Map<String, String> params = new TreeMap<>();
        params.put("method", "track.scrobble");
        params.put("artist", artist);
        params.put("track", title);
        params.put("timestamp", String.valueOf(timestamp.getEpochSecond()));
        JSONObject response = callAuthenticated("track.scrobble", params);
        if (acceptedCount(response) == 0) {
            throw new ScrobbleException("track.scrobble", "Last.fm ignored the scrobble");
        }
        LOG.info("Last.fm scrobbled: {} at {}", LogSanitizer.track(artist, title), timestamp);
    }

    @Override
    public void clearNowPlaying() {
        LOG.debug("Last.fm has no now-playing clear; letting it expire");
    }

    @Override
    public String getSinkName() {
        return "lastfm";
    }

    private JSONObject callAuthenticated(String operation, Map<String, String> params) {
        params.put("sk", sessionKey());
        try {
            return post(operation, params);
        } catch (ScrobbleException e) {
            if (Objects.equals(e.getErrorCode(), ERROR_INVALID_SESSION_KEY)) {
                LOG.warn("Last.fm session key rejected; will re-authenticate on next call");
                sessionKey = null;
            }
            throw e;
        }
    }

    String sessionKey() {
        String key = sessionKey;
        if (key != null) {
            return key;
        }
        synchronized (sessionLock) {
            if (sessionKey == null) {
                Map<String, String> params = new TreeMap<>();
                params.put("method", "auth.getMobileSession");
                params.put("username", props.getUsername());
                params.put("password", props.getPassword());
                JSONObject response = post("auth.getMobileSession", params);
                JSONObject session = response.optJSONObject("session");
                if (session == null || session.optString("key", "").isBlank()) {
                    throw new ScrobbleException("auth.getMobileSession", "No session key in response");
                }
                sessionKey = session.getString("key");
                LOG.info("Authenticated with Last.fm as {}", session.optString("name", props.getUsername()));
            }
            return sessionKey;
        }
    }

    private JSONObject post(String operation, Map<String, String> params) {
        params.put("api_key", props.getApiKey());
        String signature = sign(params, props.getApiSecret());

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        params.forEach(form::add);
        form.add("api_sig", signature);
        form.add("format", "json");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        String body;
        try {
            body = restTemplate.postForObject(props.getApiUrl(), new HttpEntity<>(form, headers), String.class);
        } catch (RestClientResponseException e) {
            body = e.getResponseBodyAsString();
            if (body == null || body.isBlank()) {
                throw new ScrobbleException(operation, "HTTP " + e.getStatusCode().value(), e);
            }
        } catch (RestClientException e) {
            throw new ScrobbleException(operation, e.getMessage(), e);
        }
        return parse(operation, body);
    }

    /** {@code scrobbles.@attr.accepted}, or -1 when absent. */
    private static int acceptedCount(JSONObject response) {
        JSONObject scrobbles = response.optJSONObject("scrobbles");
        if (scrobbles == null) {
            return -1;
        }
        JSONObject attr = scrobbles.optJSONObject("@attr");
        return attr == null ? -1 : attr.optInt("accepted", -1);
    }

    private static JSONObject parse(String operation, String body) {
        if (body == null || body.isBlank()) {
            throw new ScrobbleException(operation, "Empty response");
        }
        JSONObject json;
        try {
            json = new JSONObject(body);
        } catch (JSONException e) {
            throw new ScrobbleException(operation, "Unparseable response: " + e.getMessage(), e);
        }
        if (json.has("error")) {
            throw new ScrobbleException(operation, json.optInt("error", -1), json.optString("message", "unknown error"));
        }
        return json;
    }

    /**
     * Computes {@code api_sig} for the given parameters.
     *
     * @param params request parameters; {@code format} and {@code callback} are ignored
     * @param secret shared secret
     * @return lower-case hex md5
     */
    static String sign(Map<String, String> params, String secret) {
        StringBuilder sb = new StringBuilder();
        new TreeMap<>(params).forEach((k, v) -> {
            if (!"format".equals(k) && !"callback".equals(k)) {
                sb.append(k).append(v);
            }
        });
        sb.append(secret);
        return DigestUtils.md5DigestAsHex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }
}
