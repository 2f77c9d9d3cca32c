package com.phillippitts.vinylscrobbler.service.recognition;

import com.phillippitts.vinylscrobbler.exception.RecognitionException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Parses AudD-style recognition responses.
 *
 * <p>Shapes handled:
 * <ul>
 *   <li>match: {@code {"status":"success","result":{"artist":"...","title":"...","score":87}}}</li>
 *   <li>no match: {@code {"status":"success","result":null}}</li>
 *   <li>failure: {@code {"status":"error","error":{"error_code":901,"error_message":"..."}}}</li>
 * </ul>
 *
 * <p>{@code score} is optional and reported on a 0-100 scale; it is normalized to [0, 1].
 */
final class AuddResponseParser {

    /** Cap on the body we are willing to parse. */
    private static final int MAX_JSON_SIZE = 1_048_576;

    private AuddResponseParser() {
    }

    static Optional<RecognitionResult> parse(String json, String service) {
        if (json == null || json.isBlank()) {
            throw new RecognitionException("Empty response body", service);
        }
        if (json.length() > MAX_JSON_SIZE) {
            throw new RecognitionException("Response body too large: " + json.length() + " chars", service);
        }
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new RecognitionException("Unparseable response: " + e.getMessage(), service, e);
        }

        String status = root.optString("status", "");
        if (!"success".equalsIgnoreCase(status)) {
            JSONObject error = root.optJSONObject("error");
            String detail = error == null ? status
                    : error.optInt("error_code", -1) + " " + error.optString("error_message", "");
            throw new RecognitionException("Service returned an error: " + detail.trim(), service);
        }

        JSONObject result = root.optJSONObject("result");
        if (result == null) {
            return Optional.empty();
        }
        String artist = result.optString("artist", "").trim();
        String title = result.optString("title", "").trim();
        double confidence = 0.0;
        if (result.has("score")) {
            double raw = result.optDouble("score", 0.0);
            confidence = raw > 1.0 ? raw / 100.0 : raw;
            confidence = Math.min(1.0, Math.max(0.0, confidence));
        }
        return Optional.of(new RecognitionResult(artist, title, confidence));
    }
}
