package com.phillippitts.vinylscrobbler.config.session;

import com.phillippitts.vinylscrobbler.config.properties.AudioCaptureProperties;
import com.phillippitts.vinylscrobbler.config.properties.DetectionProperties;
import com.phillippitts.vinylscrobbler.config.properties.RecognitionProperties;
import com.phillippitts.vinylscrobbler.config.properties.ScrobbleProperties;
import com.phillippitts.vinylscrobbler.config.properties.SessionProperties;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioDeviceCatalog;
import com.phillippitts.vinylscrobbler.service.audio.capture.AudioSource;
import com.phillippitts.vinylscrobbler.service.audio.capture.JavaSoundAudioSource;
import com.phillippitts.vinylscrobbler.service.audio.capture.SampleRecorder;
import com.phillippitts.vinylscrobbler.service.level.LevelMonitor;
import com.phillippitts.vinylscrobbler.service.metrics.DetectionMetrics;
import com.phillippitts.vinylscrobbler.service.recognition.AggressiveFallback;
import com.phillippitts.vinylscrobbler.service.recognition.ConsistencyChecker;
import com.phillippitts.vinylscrobbler.service.recognition.HttpRecognitionService;
import com.phillippitts.vinylscrobbler.service.recognition.RecognitionService;
import com.phillippitts.vinylscrobbler.service.recognition.TimeLimitedRecognitionService;
import com.phillippitts.vinylscrobbler.service.scrobble.LastFmScrobbleSink;
import com.phillippitts.vinylscrobbler.service.scrobble.LoggingScrobbleSink;
import com.phillippitts.vinylscrobbler.service.scrobble.ScrobbleDeduplicator;
import com.phillippitts.vinylscrobbler.service.scrobble.ScrobbleSink;
import com.phillippitts.vinylscrobbler.service.scrobble.TimeLimitedScrobbleSink;
import com.phillippitts.vinylscrobbler.service.session.DefaultSessionManager;
import com.phillippitts.vinylscrobbler.service.session.DetectionCycle;
import com.phillippitts.vinylscrobbler.service.session.ListenerRegistry;
import com.phillippitts.vinylscrobbler.service.session.SessionManager;
import com.phillippitts.vinylscrobbler.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the detection pipeline and the session manager explicitly.
 *
 * <p>Hardware and network adapters ({@link AudioSource}, {@link RecognitionService},
 * {@link ScrobbleSink}) are plain beans so test configurations can replace them with
 * {@code @Primary} doubles.
 */
@Configuration
public class SessionConfig {

    private static final Logger LOG = LogManager.getLogger(SessionConfig.class);

    private final AudioCaptureProperties captureProperties;
    private final DetectionProperties detectionProperties;
    private final DetectionMetrics metrics;

    public SessionConfig(AudioCaptureProperties captureProperties,
                         DetectionProperties detectionProperties,
                         DetectionMetrics metrics) {
        this.captureProperties = captureProperties;
        this.detectionProperties = detectionProperties;
        this.metrics = metrics;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AudioDeviceCatalog audioDeviceCatalog() {
        return new AudioDeviceCatalog();
    }

    @Bean
    public AudioSource javaSoundAudioSource(AudioDeviceCatalog catalog) {
        return new JavaSoundAudioSource(captureProperties, catalog);
    }

    @Bean
    public SampleRecorder sampleRecorder() {
        return new SampleRecorder(captureProperties);
    }

    @Bean
    public LevelMonitor levelMonitor() {
        return new LevelMonitor(detectionProperties.getLevel());
    }

    /**
     * RestTemplate for the recognition endpoint; the read timeout matches the per-call limit.
     */
    @Bean
    public RestTemplate recognitionRestTemplate(RestTemplateBuilder builder, RecognitionProperties props) {
        return builder
                .setConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(props.getTimeoutMs()))
                .build();
    }

    /**
     * HTTP recognizer bounded by {@code recognition.timeout-ms} on the recognition executor.
     */
    @Bean
    public RecognitionService recognitionService(@Qualifier("recognitionRestTemplate") RestTemplate restTemplate,
                                                 RecognitionProperties props,
                                                 @Qualifier("recognitionExecutor") ThreadPoolTaskExecutor executor) {
        if (props.getApiToken() == null) {
            LOG.warn("recognition.api-token is not set; the recognition endpoint may reject requests");
        }
        return new TimeLimitedRecognitionService(new HttpRecognitionService(restTemplate, props),
                executor, props.getTimeoutMs());
    }

    /**
     * Last.fm when enabled and fully configured, otherwise a sink that only logs.
     */
    @Bean
    public ScrobbleSink scrobbleSink(RestTemplateBuilder builder, ScrobbleProperties props) {
        ScrobbleProperties.LastFm lastfm = props.getLastfm();
        if (lastfm.isEnabled() && lastfm.isConfigured()) {
            RestTemplate rt = builder
                    .setConnectTimeout(Duration.ofMillis(lastfm.getTimeoutMs()))
                    .setReadTimeout(Duration.ofMillis(lastfm.getTimeoutMs()))
                    .build();
            LOG.info("Scrobbling to Last.fm as {}", lastfm.getUsername());
            return new LastFmScrobbleSink(rt, lastfm);
        }
        if (lastfm.isEnabled()) {
            LOG.warn("scrobble.lastfm.enabled=true but credentials are incomplete; scrobbles will only be logged");
        } else {
            LOG.info("Last.fm disabled; scrobbles will only be logged");
        }
        return new LoggingScrobbleSink();
    }

    @Bean
    public ConsistencyChecker consistencyChecker(RecognitionService recognitionService, Sleeper sleeper) {
        return new ConsistencyChecker(recognitionService, detectionProperties.getConsistency(), sleeper, metrics);
    }

    @Bean
    public AggressiveFallback aggressiveFallback(ConsistencyChecker checker, Sleeper sleeper) {
        return new AggressiveFallback(checker, detectionProperties.getAggressive(), sleeper, metrics);
    }

    /**
     * Reports through the sink bounded by {@code scrobble.call-timeout-ms} on the scrobble executor.
     */
    @Bean
    public ScrobbleDeduplicator scrobbleDeduplicator(ScrobbleSink sink, ScrobbleProperties props,
                                                     @Qualifier("scrobbleExecutor") ThreadPoolTaskExecutor executor,
                                                     Clock clock) {
        return new ScrobbleDeduplicator(new TimeLimitedScrobbleSink(sink, executor, props.getCallTimeoutMs()),
                metrics, clock);
    }

    @Bean
    public DetectionCycle detectionCycle(SampleRecorder recorder,
                                         LevelMonitor levelMonitor,
                                         ConsistencyChecker checker,
                                         AggressiveFallback fallback,
                                         ScrobbleDeduplicator deduplicator,
                                         Sleeper sleeper,
                                         Clock clock) {
        return new DetectionCycle(recorder, levelMonitor, checker, fallback, deduplicator,
                detectionProperties.getCycle(), sleeper, metrics, clock);
    }

    @Bean
    public ListenerRegistry listenerRegistry(@Qualifier("listenerExecutor") ThreadPoolTaskExecutor executor,
                                             SessionProperties sessionProperties) {
        return new ListenerRegistry(executor, sessionProperties.getListenerQueueCapacity(), metrics);
    }

    @Bean
    public SessionManager sessionManager(AudioSource audioSource,
                                         DetectionCycle cycle,
                                         ListenerRegistry listeners,
                                         AudioDeviceCatalog catalog,
                                         SessionProperties sessionProperties,
                                         @Qualifier("sessionExecutor") ThreadPoolTaskExecutor sessionExecutor,
                                         ApplicationEventPublisher publisher) {
        return new DefaultSessionManager(audioSource, cycle, listeners, catalog, captureProperties,
                sessionProperties, sessionExecutor, publisher);
    }
}
