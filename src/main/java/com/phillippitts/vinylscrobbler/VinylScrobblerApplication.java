package com.phillippitts.vinylscrobbler;

import com.phillippitts.vinylscrobbler.config.properties.AudioCaptureProperties;
import com.phillippitts.vinylscrobbler.config.properties.DetectionProperties;
import com.phillippitts.vinylscrobbler.config.properties.RecognitionProperties;
import com.phillippitts.vinylscrobbler.config.properties.ScrobbleProperties;
import com.phillippitts.vinylscrobbler.config.properties.SessionProperties;
import com.phillippitts.vinylscrobbler.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        DetectionProperties.class,
        RecognitionProperties.class,
        ScrobbleProperties.class,
        SessionProperties.class,
        ThreadPoolProperties.class
})
public class VinylScrobblerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VinylScrobblerApplication.class, args);
    }

}
