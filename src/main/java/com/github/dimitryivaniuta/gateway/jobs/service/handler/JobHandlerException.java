package com.github.dimitryivaniuta.gateway.jobs.service.handler;

/**
 * Classified handler failure.
 */
public abstract class JobHandlerException extends Exception {

    protected JobHandlerException(String message) {
        super(message);
    }

    protected JobHandlerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether another attempt may succeed.
     *
     * @return true for transient failures
     */
    public abstract boolean isRetryable();
}
