package com.workoutapi.refresh.exception;

/**
 * Another refresh run is still in progress in this process.
 */
public class RefreshInProgressException extends RuntimeException {

    public RefreshInProgressException() {
        super("A refresh run is already in progress");
    }
}
