package com.transit.ingest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executors for page fetches and HTTP calls. The {@code ObjectMapper} comes from Spring Boot's
 * Jackson auto-configuration.
 */
@Configuration
public class IngestConfig {

    @Bean(name = "fetchExecutor", destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(IngestProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetchConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(IngestProperties properties) {
        int size = Math.max(2, properties.getFetchConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }
}
