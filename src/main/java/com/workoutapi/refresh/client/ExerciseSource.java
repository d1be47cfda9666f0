package com.workoutapi.refresh.client;

import com.workoutapi.refresh.model.Exercise;

import java.util.List;

public interface ExerciseSource {

    List<Exercise> listExercises();

    /**
     * Remote verification call. Throws
     * {@link com.workoutapi.refresh.exception.ExerciseNotFoundException} when the
     * exercise no longer exists; any other exception is treated as transient.
     */
    Exercise fetchExercise(long exerciseId);
}
