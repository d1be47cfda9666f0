package com.workoutapi.refresh.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Assembles the {@link RefreshConfig} snapshot from {@code refresh.*} properties.
 * Fractional second values (retry delay, timeout) are accepted as in the CLI.
 */
@Configuration
@Slf4j
public class RefreshConfiguration {

    @Bean
    public RefreshConfig refreshConfig(
            @Value("${refresh.api-url:http://localhost:8000}") String apiUrl,
            @Value("${refresh.store-url:redis://localhost:6379/0}") String storeUrl,
            @Value("${refresh.max-concurrency:3}") int maxConcurrency,
            @Value("${refresh.max-retries:3}") int maxRetries,
            @Value("${refresh.retry-base-delay:1.0}") double retryBaseDelaySeconds,
            @Value("${refresh.idempotency-ttl:3600}") long idempotencyTtlSeconds,
            @Value("${refresh.timeout:10.0}") double timeoutSeconds,
            @Value("${refresh.worker-threads:16}") int workerThreads) {

        RefreshConfig config = RefreshConfig.builder()
                .apiUrl(apiUrl)
                .storeUrl(storeUrl)
                .maxConcurrency(maxConcurrency)
                .maxRetries(maxRetries)
                .retryBaseDelay(fromSeconds(retryBaseDelaySeconds))
                .idempotencyTtl(Duration.ofSeconds(idempotencyTtlSeconds))
                .timeout(fromSeconds(timeoutSeconds))
                .workerThreads(workerThreads)
                .build()
                .validate();

        log.info("⚙️ Refresh config loaded: api={}, concurrency={}, maxRetries={}, ttl={}s",
                config.getApiUrl(), config.getMaxConcurrency(), config.getMaxRetries(),
                config.getIdempotencyTtl().getSeconds());
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static Duration fromSeconds(double seconds) {
        return Duration.ofMillis(Math.round(seconds * 1000));
    }
}
