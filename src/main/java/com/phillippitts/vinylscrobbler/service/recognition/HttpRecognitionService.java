package com.phillippitts.vinylscrobbler.service.recognition;

import com.phillippitts.vinylscrobbler.config.properties.RecognitionProperties;
import com.phillippitts.vinylscrobbler.exception.RecognitionException;
import com.phillippitts.vinylscrobbler.service.audio.PcmBuffer;
import com.phillippitts.vinylscrobbler.service.audio.WavWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recognition over HTTP: uploads the sample as a mono WAV file and reads an AudD-style answer.
 *
 * <p>The request is {@code multipart/form-data} with fields {@code file} (audio/wav) and,
 * when configured, {@code api_token}. Timeouts come from the injected {@link RestTemplate};
 * the overall call is additionally bounded by {@link TimeLimitedRecognitionService}.
 */
public class HttpRecognitionService implements RecognitionService {

    private static final Logger LOG = LogManager.getLogger(HttpRecognitionService.class);

    static final String SERVICE_NAME = "audd";

    private final RestTemplate restTemplate;
    private final RecognitionProperties props;

    public HttpRecognitionService(RestTemplate restTemplate, RecognitionProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public Optional<RecognitionResult> identify(PcmBuffer sample) {
        Objects.requireNonNull(sample, "sample");
        if (sample.isEmpty()) {
            throw new IllegalArgumentException("sample must not be empty");
        }
        byte[] wav = WavWriter.toWav(sample);

        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        if (props.getApiToken() != null) {
            form.add("api_token", props.getApiToken());
        }
        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentType(MediaType.parseMediaType("audio/wav"));
        form.add("file", new HttpEntity<>(new NamedByteArrayResource(wav, "sample.wav"), fileHeaders));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        long t0 = System.nanoTime();
        String body;
        try {
            body = restTemplate.postForObject(props.getEndpoint(), new HttpEntity<>(form, headers), String.class);
        } catch (RestClientResponseException e) {
            throw new RecognitionException("HTTP " + e.getStatusCode().value() + " from recognition endpoint",
                    SERVICE_NAME, e);
        } catch (ResourceAccessException e) {
            throw new RecognitionException("Recognition endpoint unreachable: " + e.getMessage(), SERVICE_NAME, e);
        } catch (RestClientException e) {
            throw new RecognitionException("Recognition request failed: " + e.getMessage(), SERVICE_NAME, e);
        }
        long ms = (System.nanoTime() - t0) / 1_000_000L;

        Optional<RecognitionResult> result = AuddResponseParser.parse(body, SERVICE_NAME);
        LOG.debug("Recognition answered in {} ms: {}", ms, result.map(Object::toString).orElse("no match"));
        return result;
    }

    @Override
    public String getServiceName() {
        return SERVICE_NAME;
    }

    /** Multipart file parts need a filename or the server treats them as plain fields. */
    private static final class NamedByteArrayResource extends ByteArrayResource {
        private final String filename;

        NamedByteArrayResource(byte[] bytes, String filename) {
            super(bytes);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}
