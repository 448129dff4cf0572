package com.phillippitts.callscribe.config;

import com.phillippitts.callscribe.config.properties.TranscriptProperties;
import com.phillippitts.callscribe.service.transcript.RetentionPruner;
import com.phillippitts.callscribe.service.transcript.TranscriptStore;
import com.phillippitts.callscribe.util.SafePaths;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class TranscriptConfig {

    @Bean
    public TranscriptStore transcriptStore(TranscriptProperties properties) {
        Path dir = SafePaths.resolveWithinCwd("transcript.dir", properties.getDir(),
                properties.isAllowAbsolutePaths());
        TranscriptProperties.Retention retention = properties.getRetention();
        return new TranscriptStore(dir, new RetentionPruner(retention.getMaxFiles(), retention.getMaxAgeDays()));
    }
}
