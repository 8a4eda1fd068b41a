package com.github.dimitryivaniuta.gateway.jobs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.jobs.service.transport.ExternalQueueTransport;
import com.github.dimitryivaniuta.gateway.jobs.service.transport.LocalQueueTransport;
import com.github.dimitryivaniuta.gateway.jobs.service.transport.QueueTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Selects the queue transport once, from {@code app.queue.mode}.
 *
 * <p>Configuration is validated here, so missing external-queue credentials fail the application context
 * instead of silently degrading to local mode.</p>
 */
@Configuration
public class QueueTransportConfig {

    private static final Logger log = LoggerFactory.getLogger(QueueTransportConfig.class);

    /**
     * Queue transport bean.
     *
     * @param properties app properties
     * @param restClientBuilder builder provided by Spring Boot
     * @param objectMapper jackson mapper
     * @return transport for the configured mode
     */
    @Bean
    public QueueTransport queueTransport(AppProperties properties, RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        properties.validate();

        return switch (properties.getQueue().getMode()) {
            case LOCAL -> {
                if (!properties.getWorker().isEnabled()) {
                    log.warn("QUEUE_MODE=local and app.worker.enabled=false: jobs stay pending until a worker process "
                            + "(profile 'worker') polls them; see {}", AppProperties.QUEUE_SETUP_DOC);
                }
                yield new LocalQueueTransport();
            }
            case EXTERNAL -> {
                int timeoutMs = (int) properties.getQueue().getSendTimeout().toMillis();
                SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
                requestFactory.setConnectTimeout(timeoutMs);
                requestFactory.setReadTimeout(timeoutMs);
                yield new ExternalQueueTransport(restClientBuilder.requestFactory(requestFactory),
                        properties.getQueue(), objectMapper);
            }
        };
    }
}
