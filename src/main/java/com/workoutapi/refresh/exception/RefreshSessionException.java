package com.workoutapi.refresh.exception;

/**
 * A refresh run could not start because its run-scoped resources (HTTP
 * transport, store connection) could not be built.
 */
public class RefreshSessionException extends RuntimeException {

    public RefreshSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
