package com.phillippitts.mindscribe;

import com.phillippitts.mindscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.mindscribe.config.properties.ChunkerProperties;
import com.phillippitts.mindscribe.config.properties.HotkeyProperties;
import com.phillippitts.mindscribe.config.properties.SessionProperties;
import com.phillippitts.mindscribe.config.properties.ThreadPoolProperties;
import com.phillippitts.mindscribe.config.properties.TranscriptionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioCaptureProperties.class,
        SessionProperties.class,
        ChunkerProperties.class,
        HotkeyProperties.class,
        TranscriptionProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class MindScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MindScribeApplication.class, args);
    }

}
