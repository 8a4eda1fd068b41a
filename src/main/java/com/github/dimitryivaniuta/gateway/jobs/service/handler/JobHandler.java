package com.github.dimitryivaniuta.gateway.jobs.service.handler;

import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import java.util.Set;

/**
 * Pluggable job handler (YouTube ingest, blog generation, ...).
 *
 * <p>Handlers must classify failures explicitly: throw {@link RetryableJobException} for transient problems
 * and {@link FatalJobException} when retrying cannot help. Any other runtime exception is treated as
 * retryable. A handler may be invoked more than once for the same job (at-least-once delivery).</p>
 */
public interface JobHandler {

    /**
     * Job types served by this handler. Each type may be served by exactly one handler.
     *
     * @return handled types
     */
    Set<JobType> handledTypes();

    /**
     * Executes one attempt.
     *
     * @param context job input
     * @return output stored on the job
     * @throws JobHandlerException classified failure
     */
    JobResult handle(JobContext context) throws JobHandlerException;
}
