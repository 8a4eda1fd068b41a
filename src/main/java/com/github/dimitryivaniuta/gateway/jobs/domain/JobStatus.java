package com.github.dimitryivaniuta.gateway.jobs.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Job lifecycle status.
 *
 * <p>Stored as a VARCHAR enum name in the DB (no DB-level enum constraints) and exposed in lower case on the API.</p>
 */
public enum JobStatus {
    /** Waiting to be claimed (new, or re-queued for retry after {@code nextAttemptAt}). */
    PENDING,
    /** Claimed by exactly one consumer. */
    PROCESSING,
    /** Handler succeeded; output stored. */
    COMPLETED,
    /** Fatal failure or retries exhausted; a dead-letter record exists. */
    FAILED,
    /** Cancelled by an out-of-band actor before terminal resolution. */
    CANCELLED;

    /**
     * Terminal statuses never transition again.
     *
     * @return true for completed, failed and cancelled
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
