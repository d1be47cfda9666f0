package com.workoutapi.refresh.client;

import com.workoutapi.refresh.exception.ExerciseNotFoundException;
import com.workoutapi.refresh.model.Exercise;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Workout API client. Every call is bounded by the configured per-call timeout.
 */
public class ExerciseApiClient implements ExerciseSource {

        private final WebClient webClient;
        private final Duration timeout;

        public ExerciseApiClient(WebClient webClient, Duration timeout) {
                this.webClient = webClient;
                this.timeout = timeout;
        }

        @Override
        public List<Exercise> listExercises() {
                List<Exercise> exercises = webClient.get()
                                .uri("/exercises")
                                .retrieve()
                                .bodyToFlux(Exercise.class)
                                .timeout(timeout)
                                .collectList()
                                .block();
                return exercises != null ? exercises : List.of();
        }

        @Override
        public Exercise fetchExercise(long exerciseId) {
                Exercise exercise = webClient.get()
                                .uri(uriBuilder -> uriBuilder
                                                .path("/exercises/{id}")
                                                .build(exerciseId))
                                .retrieve()
                                .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value(),
                                                response -> Mono.error(new ExerciseNotFoundException(exerciseId)))
                                .bodyToMono(Exercise.class)
                                .timeout(timeout)
                                .block();
                if (exercise == null) {
                        throw new IllegalStateException("Empty response body for exercise " + exerciseId);
                }
                return exercise;
        }
}
