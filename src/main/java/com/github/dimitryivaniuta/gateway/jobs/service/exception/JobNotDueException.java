package com.github.dimitryivaniuta.gateway.jobs.service.exception;

import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import java.time.Instant;

/**
 * A pending job was delivered before its retry gate ({@code next_attempt_at}).
 */
public class JobNotDueException extends JobConflictException {

    private final Instant nextAttemptAt;

    public JobNotDueException(String jobId, Instant nextAttemptAt) {
        super(jobId, JobStatus.PENDING, "claim");
        this.nextAttemptAt = nextAttemptAt;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }
}
