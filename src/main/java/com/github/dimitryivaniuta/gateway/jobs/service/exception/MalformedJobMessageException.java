package com.github.dimitryivaniuta.gateway.jobs.service.exception;

/**
 * A queue message that cannot be mapped onto a job (bad JSON, or missing job_id/user_id/job_type).
 *
 * <p>Carries the raw body so it can be dead-lettered as-is.</p>
 */
public class MalformedJobMessageException extends JobValidationException {

    private final String rawMessage;

    public MalformedJobMessageException(String message, String rawMessage) {
        super(message);
        this.rawMessage = rawMessage;
    }

    public MalformedJobMessageException(String message, String rawMessage, Throwable cause) {
        super(message, cause);
        this.rawMessage = rawMessage;
    }

    public String getRawMessage() {
        return rawMessage;
    }
}
