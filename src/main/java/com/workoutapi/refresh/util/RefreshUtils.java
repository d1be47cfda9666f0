package com.workoutapi.refresh.util;

import org.springframework.web.reactive.function.client.WebClientResponseException;

public class RefreshUtils {

    private RefreshUtils() {
    }

    /**
     * Short human-readable description of a failure, used in logs and result
     * messages.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        if (error instanceof WebClientResponseException) {
            return "HTTP " + ((WebClientResponseException) error).getStatusCode().value();
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    /**
     * Drops any password from a connection URL before it is logged.
     */
    public static String redactUrl(String url) {
        if (url == null) {
            return null;
        }
        return url.replaceAll("//[^@/]*@", "//***@");
    }

    public static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
