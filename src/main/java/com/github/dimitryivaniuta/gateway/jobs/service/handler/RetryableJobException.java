package com.github.dimitryivaniuta.gateway.jobs.service.handler;

/**
 * Transient failure (rate limit, network, upstream 5xx, timeout). The job is re-queued with backoff until the
 * attempt budget is used up.
 */
public class RetryableJobException extends JobHandlerException {

    public RetryableJobException(String message) {
        super(message);
    }

    public RetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
