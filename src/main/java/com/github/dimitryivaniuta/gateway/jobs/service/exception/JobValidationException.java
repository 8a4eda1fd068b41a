package com.github.dimitryivaniuta.gateway.jobs.service.exception;

/**
 * Malformed enqueue request, wire message or query parameter. Never retried.
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
