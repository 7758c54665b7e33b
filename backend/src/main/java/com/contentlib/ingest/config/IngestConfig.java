package com.contentlib.ingest.config;

import com.contentlib.ingest.pipeline.reader.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class IngestConfig {

    @Bean(name = "discoveryExecutor", destroyMethod = "shutdown")
    public ExecutorService discoveryExecutor(IngestProperties properties) {
        return Executors.newFixedThreadPool(properties.getValidation().getConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(IngestProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
