package com.phillippitts.callscribe;

import com.phillippitts.callscribe.config.properties.AlertProperties;
import com.phillippitts.callscribe.config.properties.CaptureProperties;
import com.phillippitts.callscribe.config.properties.DeliveryProperties;
import com.phillippitts.callscribe.config.properties.HealthProperties;
import com.phillippitts.callscribe.config.properties.SessionProperties;
import com.phillippitts.callscribe.config.properties.SummaryProperties;
import com.phillippitts.callscribe.config.properties.TranscriptProperties;
import com.phillippitts.callscribe.config.stt.PythonSttConfig;
import com.phillippitts.callscribe.config.stt.SttProperties;
import com.phillippitts.callscribe.config.stt.VoskConfig;
import com.phillippitts.callscribe.config.stt.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SttProperties.class,
        WhisperConfig.class,
        VoskConfig.class,
        PythonSttConfig.class,
        SessionProperties.class,
        CaptureProperties.class,
        TranscriptProperties.class,
        SummaryProperties.class,
        DeliveryProperties.class,
        AlertProperties.class,
        HealthProperties.class
})
@EnableScheduling
public class CallScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallScribeApplication.class, args);
    }

}
