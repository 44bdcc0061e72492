package com.grantradar.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.grantradar.catalog.classify.ClassificationRules;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RadarConfig {

    @Bean(name = "enrichmentExecutor", destroyMethod = "shutdown")
    public ExecutorService enrichmentExecutor(RadarProperties properties) {
        return Executors.newFixedThreadPool(properties.getEnrichment().getParallelism());
    }

    @Bean
    public ClassificationRules classificationRules(RadarProperties properties) {
        return ClassificationRules.fromProperties(properties);
    }

    @Bean
    public Clock radarClock(RadarProperties properties) {
        return Clock.system(properties.getZoneId());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
