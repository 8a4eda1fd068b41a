package com.github.dimitryivaniuta.gateway.jobs.service.exception;

import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;

/**
 * A state transition was attempted from a state that does not allow it (double claim, double completion,
 * cancelling a finished job).
 *
 * <p>The consumer treats it as a benign skip (at-least-once delivery); API callers get 409.</p>
 */
public class JobConflictException extends RuntimeException {

    private final String jobId;
    private final JobStatus currentStatus;
    private final String attempted;

    public JobConflictException(String jobId, JobStatus currentStatus, String attempted) {
        super("Cannot " + attempted + " job '" + jobId + "' in status " + currentStatus.wireName());
        this.jobId = jobId;
        this.currentStatus = currentStatus;
        this.attempted = attempted;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getCurrentStatus() {
        return currentStatus;
    }

    public String getAttempted() {
        return attempted;
    }
}
