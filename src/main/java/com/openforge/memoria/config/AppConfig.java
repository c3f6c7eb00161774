package com.openforge.memoria.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Core infrastructure beans:
 *  - session consumer executor → one platform thread per live session consumer
 *  - Java HttpClient           → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - Jackson ObjectMapper      → snake_case ↔ camelCase, Java time, tolerant deserialization
 *  - Clock                     → single time source for epoch timestamps and staleness rules
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /**
     * Consumers block for most of their life (queue waits, provider calls,
     * helper processes), so the pool is unbounded and sized by the number of
     * live sessions. Spring calls shutdownNow() on context close.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sessionProcessorExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("session-consumer-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Single, shared HttpClient instance; per-request read timeouts are set at call site.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * Shared ObjectMapper:
     *  - snake_case property names (finish_reason, content_session_id …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (providers add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
