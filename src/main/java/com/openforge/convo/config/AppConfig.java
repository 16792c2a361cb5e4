package com.openforge.convo.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - tool executor       → bounded pool that runs one turn's tool calls side by side
 *  - Java HttpClient     → the ONLY HTTP engine; every adapter shares it
 *  - Jackson ObjectMapper → Java time support, tolerant deserialization
 *
 * The ObjectMapper keeps Java property names: adapters build their wire
 * JSON as trees with explicit field names, so no naming strategy is applied.
 */
@Configuration
@EnableConfigurationProperties(ConvoProperties.class)
public class AppConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutorService(ConvoProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread t = new Thread(runnable, "convo-tool-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(properties.tools().parallelism(), threads);
    }

    /**
     * Single, shared HttpClient instance.
     * 10 s connect timeout; per-request read timeouts are set by each adapter
     * from its provider's timeout-ms.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
