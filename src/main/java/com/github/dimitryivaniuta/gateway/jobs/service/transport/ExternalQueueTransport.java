package com.github.dimitryivaniuta.gateway.jobs.service.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.jobs.config.AppProperties;
import com.github.dimitryivaniuta.gateway.jobs.config.QueueMode;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.QueueTransportException;
import com.github.dimitryivaniuta.gateway.jobs.service.message.DeadLetterMessage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessage;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Managed queue over its HTTP API.
 *
 * <p>Request: {@code POST {base}/accounts/{account}/queues/{queue}/messages} with a Bearer token and
 * {@code {"messages":[{"body":"<json>","timestamp_ms":...,"delay_seconds":...}]}}.</p>
 */
public class ExternalQueueTransport implements QueueTransport {

    private static final Logger log = LoggerFactory.getLogger(ExternalQueueTransport.class);

    /** Largest delivery delay the queue API accepts (12h). */
    static final long MAX_DELAY_SECONDS = 43_200L;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiToken;
    private final String queueName;
    private final String deadLetterQueueName;
    private final URI queueUri;
    private final URI deadLetterQueueUri;

    /**
     * Creates the transport and validates both endpoint URLs.
     *
     * @param restClientBuilder builder with timeouts already applied
     * @param queue queue settings
     * @param objectMapper jackson mapper
     * @throws IllegalStateException when the settings do not form valid endpoint URLs
     */
    public ExternalQueueTransport(RestClient.Builder restClientBuilder, AppProperties.Queue queue, ObjectMapper objectMapper) {
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
        this.apiToken = queue.getApiToken();
        this.queueName = queue.getQueueName();
        this.deadLetterQueueName = queue.getDeadLetterQueueName();
        this.queueUri = endpoint(queue.getApiBaseUrl(), queue.getAccountId(), queueName);
        this.deadLetterQueueUri = endpoint(queue.getApiBaseUrl(), queue.getAccountId(), deadLetterQueueName);
        log.info("External queue transport initialized. queue={} dlq={}", queueName, deadLetterQueueName);
    }

    @Override
    public QueueMode mode() {
        return QueueMode.EXTERNAL;
    }

    @Override
    public void send(JobMessage message) {
        post(queueUri, queueName, message, null);
    }

    @Override
    public void sendDelayed(JobMessage message, Duration delay) {
        long seconds = Math.max(0L, delay.toSeconds() + (delay.toNanosPart() > 0 ? 1 : 0));
        post(queueUri, queueName, message, Math.min(seconds, MAX_DELAY_SECONDS));
    }

    @Override
    public boolean supportsDelayedDelivery() {
        return true;
    }

    @Override
    public void sendToDeadLetter(DeadLetterMessage message) {
        post(deadLetterQueueUri, deadLetterQueueName, message, null);
    }

    private void post(URI uri, String queue, Object message, Long delaySeconds) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("body", serialize(message));
        entry.put("timestamp_ms", Instant.now().toEpochMilli());
        if (delaySeconds != null && delaySeconds > 0) {
            entry.put("delay_seconds", delaySeconds);
        }

        try {
            restClient.post()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("messages", List.of(entry)))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            log.error("Queue send failed. queue={} status={} body={}; check app.queue.* settings, see {}",
                    queue, status, e.getResponseBodyAsString(), AppProperties.QUEUE_SETUP_DOC);
            throw new QueueTransportException("Queue '" + queue + "' rejected message with HTTP " + status, status, e);
        } catch (RestClientException e) {
            log.error("Queue send failed. queue={} error={}; check app.queue.* settings, see {}",
                    queue, e.getMessage(), AppProperties.QUEUE_SETUP_DOC);
            throw new QueueTransportException("Queue '" + queue + "' unreachable: " + e.getMessage(), null, e);
        }
    }

    private String serialize(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize queue message", e);
        }
    }

    private static URI endpoint(String baseUrl, String accountId, String queue) {
        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                    .pathSegment("accounts", accountId, "queues", queue, "messages")
                    .build()
                    .encode()
                    .toUri();
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("missing host");
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid queue endpoint for '" + queue + "' from base URL '" + baseUrl
                    + "'; see " + AppProperties.QUEUE_SETUP_DOC, e);
        }
    }
}
