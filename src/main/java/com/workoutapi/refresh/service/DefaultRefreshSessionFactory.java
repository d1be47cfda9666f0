package com.workoutapi.refresh.service;

import com.workoutapi.refresh.client.ExerciseApiClient;
import com.workoutapi.refresh.config.RefreshConfig;
import com.workoutapi.refresh.exception.RefreshSessionException;
import com.workoutapi.refresh.repository.KeyValueBackend;
import com.workoutapi.refresh.repository.redis.RedisKeyValueBackend;
import com.workoutapi.refresh.util.RefreshUtils;
import io.lettuce.core.RedisURI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a fresh HTTP transport and Redis connection for every run.
 *
 * <p>
 * Failing to build the HTTP client aborts the run. Failing to reach Redis only
 * degrades the run to in-memory idempotency.
 */
@Component
@Slf4j
public class DefaultRefreshSessionFactory implements RefreshSessionFactory {

    private final WebClient.Builder webClientBuilder;
    private final Clock clock;

    public DefaultRefreshSessionFactory(WebClient.Builder webClientBuilder, Clock clock) {
        this.webClientBuilder = webClientBuilder;
        this.clock = clock;
    }

    @Override
    public RefreshSession open(RefreshConfig config) {
        List<Runnable> closeActions = new ArrayList<>();

        ConnectionProvider connectionProvider = null;
        ExerciseApiClient exerciseClient;
        try {
            connectionProvider = ConnectionProvider.builder("exercise-refresh")
                    .maxConnections(config.getMaxConcurrency() * 2)
                    .build();

            HttpClient httpClient = HttpClient.create(connectionProvider)
                    .responseTimeout(config.getTimeout());
            WebClient webClient = webClientBuilder.clone()
                    .baseUrl(config.getApiUrl())
                    .clientConnector(new ReactorClientHttpConnector(httpClient))
                    .codecs(configurer -> configurer
                            .defaultCodecs()
                            .maxInMemorySize(2 * 1024 * 1024)) // 2MB
                    .build();
            exerciseClient = new ExerciseApiClient(webClient, config.getTimeout());
        } catch (RuntimeException e) {
            if (connectionProvider != null) {
                connectionProvider.dispose();
            }
            throw new RefreshSessionException("Could not create Workout API client for " + config.getApiUrl(), e);
        }
        closeActions.add(connectionProvider::dispose);

        KeyValueBackend backend = connectRedis(config, closeActions);
        IdempotencyStore idempotencyStore = new IdempotencyStore(backend, config.getIdempotencyTtl(), clock);

        return new RefreshSession(exerciseClient, idempotencyStore, closeActions);
    }

    private KeyValueBackend connectRedis(RefreshConfig config, List<Runnable> closeActions) {
        String redactedUrl = RefreshUtils.redactUrl(config.getStoreUrl());
        LettuceConnectionFactory connectionFactory = null;
        try {
            connectionFactory = createConnectionFactory(config);
            RedisKeyValueBackend backend = new RedisKeyValueBackend(new StringRedisTemplate(connectionFactory));
            backend.ping();

            closeActions.add(connectionFactory::destroy);
            log.info("✅ Connected to Redis at {}", redactedUrl);
            return backend;
        } catch (RuntimeException e) {
            log.warn("⚠️ Redis connection failed at {}: {}. Using in-memory idempotency.", redactedUrl,
                    e.getMessage());
            if (connectionFactory != null) {
                connectionFactory.destroy();
            }
            return null;
        }
    }

    private LettuceConnectionFactory createConnectionFactory(RefreshConfig config) {
        RedisURI uri = RedisURI.create(config.getStoreUrl());

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        standalone.setDatabase(uri.getDatabase());
        if (uri.getPassword() != null && uri.getPassword().length > 0) {
            standalone.setPassword(uri.getPassword());
        }

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(config.getTimeout())
                .build();

        LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(standalone, clientConfig);
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        return connectionFactory;
    }
}
