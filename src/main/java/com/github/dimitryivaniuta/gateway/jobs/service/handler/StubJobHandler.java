package com.github.dimitryivaniuta.gateway.jobs.service.handler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic handler used for local development.
 *
 * <p>Serves every job type and echoes the payload back. Payload flags simulate failures:
 * {@code "simulate": "retryable"} or {@code "simulate": "fatal"}.</p>
 */
@Component
@ConditionalOnProperty(prefix = "app.jobs", name = "stub-handlers-enabled", havingValue = "true")
public class StubJobHandler implements JobHandler {

    @Override
    public Set<JobType> handledTypes() {
        return EnumSet.allOf(JobType.class);
    }

    @Override
    public JobResult handle(JobContext context) throws JobHandlerException {
        String simulate = context.payload() == null ? "" : context.payload().path("simulate").asText("");
        if ("retryable".equals(simulate)) {
            throw new RetryableJobException("Simulated transient failure on attempt " + context.attempt());
        }
        if ("fatal".equals(simulate)) {
            throw new FatalJobException("Simulated fatal failure");
        }

        ObjectNode out = JsonNodeFactory.instance.objectNode();
        out.put("jobType", context.jobType().wireName());
        out.put("attempt", context.attempt());
        out.set("echo", context.payload());
        return JobResult.of(out);
    }
}
