package com.github.dimitryivaniuta.gateway.jobs.service.handler;

/**
 * Permanent failure (invalid input, missing resource). The job is dead-lettered right away.
 */
public class FatalJobException extends JobHandlerException {

    public FatalJobException(String message) {
        super(message);
    }

    public FatalJobException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
