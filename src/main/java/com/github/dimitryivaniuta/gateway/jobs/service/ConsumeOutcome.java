package com.github.dimitryivaniuta.gateway.jobs.service;

/**
 * Result of consuming one queue message.
 */
public enum ConsumeOutcome {
    COMPLETED,
    RETRY_SCHEDULED,
    DEAD_LETTERED,
    /** Job was not pending: redelivery of a message already claimed or finished. */
    SKIPPED_DUPLICATE,
    SKIPPED_CANCELLED,
    /** Pending job delivered before {@code next_attempt_at}; re-sent with the remaining delay where supported. */
    SKIPPED_NOT_DUE,
    SKIPPED_UNKNOWN_JOB,
    REJECTED_MALFORMED,
    /** Infrastructure failure (e.g. database unavailable); the message was not handled and must be redelivered. */
    ERROR
}
