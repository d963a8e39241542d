package com.jreinhal.caseflow.config;

import com.jreinhal.caseflow.casework.pipeline.PipelineProperties;
import com.jreinhal.caseflow.casework.pipeline.StageVocabulary;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public StageVocabulary stageVocabulary(PipelineProperties properties) {
        if (!properties.getStages().isEmpty()) {
            log.info("Applying stage overrides for categories: {}", properties.getStages().keySet());
        }
        return StageVocabulary.withOverrides(properties.getStages());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
