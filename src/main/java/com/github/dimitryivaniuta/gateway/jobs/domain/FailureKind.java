package com.github.dimitryivaniuta.gateway.jobs.domain;

/**
 * Why a message ended up in the dead-letter path.
 */
public enum FailureKind {
    /** Handler kept raising retryable errors until {@code max-job-retries} attempts were used. */
    RETRIES_EXHAUSTED,
    /** Handler raised a non-retryable error (or no handler exists for the job type). */
    FATAL,
    /** Wire message could not be parsed or lacked job_id/user_id/job_type. */
    MALFORMED_MESSAGE
}
