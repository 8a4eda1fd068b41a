package com.github.dimitryivaniuta.gateway.jobs.service.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.MalformedJobMessageException;
import org.springframework.stereotype.Component;

/**
 * JSON conversion for queue messages and stored payloads.
 *
 * <p>Only the envelope is validated ({@code job_id}, {@code user_id}, {@code job_type} must be non-blank strings);
 * payload internals belong to the handlers.</p>
 */
@Component
public class JobMessageCodec {

    private final ObjectMapper objectMapper;

    /**
     * Creates the codec.
     *
     * @param objectMapper jackson mapper
     */
    public JobMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses and validates a raw wire message.
     *
     * @param raw message body
     * @return message
     * @throws MalformedJobMessageException when the body is not a JSON object or lacks a required field
     */
    public JobMessage parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedJobMessageException("Empty queue message", raw);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedJobMessageException("Queue message is not valid JSON: " + e.getOriginalMessage(), raw, e);
        }
        return fromTree(node, raw);
    }

    /**
     * Validates an already parsed message (e.g. one element of a push batch).
     *
     * @param node message tree
     * @return message
     */
    public JobMessage fromTree(JsonNode node) {
        return fromTree(node, node == null ? null : node.toString());
    }

    private JobMessage fromTree(JsonNode node, String raw) {
        if (node == null || !node.isObject()) {
            throw new MalformedJobMessageException("Queue message must be a JSON object", raw);
        }
        String jobId = requiredText(node, "job_id", raw);
        String userId = requiredText(node, "user_id", raw);
        String jobType = requiredText(node, "job_type", raw);
        JsonNode documentNode = node.get("document_id");
        String documentId = documentNode != null && documentNode.isTextual() && !documentNode.asText().isBlank()
                ? documentNode.asText()
                : null;
        JsonNode payload = node.get("payload");
        if (payload == null || payload.isNull()) {
            payload = objectMapper.createObjectNode();
        }
        return new JobMessage(jobId, userId, jobType, documentId, payload);
    }

    /**
     * Builds the wire message for a stored job (used by the local poller and re-sends).
     *
     * @param job job row
     * @return message
     */
    public JobMessage fromJob(Job job) {
        return new JobMessage(job.getId(), job.getUserId(), job.getJobType().wireName(), job.getDocumentId(),
                readPayload(job.getPayload()));
    }

    public String write(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize queue message", e);
        }
    }

    /**
     * Reads a stored JSON document; corrupt content is returned as a text node instead of failing.
     *
     * @param json stored JSON
     * @return tree, or null when json is null
     */
    public JsonNode readPayload(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(json);
        }
    }

    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }

    private static String requiredText(JsonNode node, String field, String raw) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            throw new MalformedJobMessageException("Queue message is missing '" + field + "'", raw);
        }
        return v.asText().trim();
    }
}
