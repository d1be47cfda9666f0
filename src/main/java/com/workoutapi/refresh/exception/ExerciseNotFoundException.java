package com.workoutapi.refresh.exception;

import lombok.Getter;

/**
 * The Workout API answered 404 for an exercise. Never retried.
 */
@Getter
public class ExerciseNotFoundException extends RuntimeException {

    private final long exerciseId;

    public ExerciseNotFoundException(long exerciseId) {
        super("Exercise " + exerciseId + " not found");
        this.exerciseId = exerciseId;
    }
}
