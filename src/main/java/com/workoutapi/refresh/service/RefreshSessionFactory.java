package com.workoutapi.refresh.service;

import com.workoutapi.refresh.config.RefreshConfig;

@FunctionalInterface
public interface RefreshSessionFactory {

    /**
     * Opens the run-scoped resources for one refresh run.
     *
     * @throws com.workoutapi.refresh.exception.RefreshSessionException if the
     *         run cannot start at all
     */
    RefreshSession open(RefreshConfig config);
}
