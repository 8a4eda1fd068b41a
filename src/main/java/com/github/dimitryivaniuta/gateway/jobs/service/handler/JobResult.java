package com.github.dimitryivaniuta.gateway.jobs.service.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Handler output.
 *
 * @param output JSON stored on the completed job
 */
public record JobResult(JsonNode output) {

    public static JobResult of(JsonNode output) {
        return new JobResult(output == null ? JsonNodeFactory.instance.objectNode() : output);
    }

    public static JobResult empty() {
        return new JobResult(JsonNodeFactory.instance.objectNode());
    }
}
