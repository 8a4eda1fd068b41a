package com.github.dimitryivaniuta.gateway.jobs.service.transport;

import com.github.dimitryivaniuta.gateway.jobs.config.QueueMode;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.QueueTransportException;
import com.github.dimitryivaniuta.gateway.jobs.service.message.DeadLetterMessage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessage;
import java.time.Duration;

/**
 * Delivers job messages to consumers.
 *
 * <p>Exactly one implementation is active per process, selected by {@code app.queue.mode}. Implementations
 * never touch the job store; the pending row is already committed when {@link #send} is called.</p>
 */
public interface QueueTransport {

    QueueMode mode();

    /**
     * Dispatches a job message for immediate delivery.
     *
     * @param message message
     * @throws QueueTransportException when the message could not be handed to the queue
     */
    void send(JobMessage message);

    /**
     * Dispatches a job message that must not be delivered before the delay has passed.
     *
     * @param message message
     * @param delay delivery delay
     * @throws QueueTransportException when the message could not be handed to the queue
     * @throws UnsupportedOperationException when {@link #supportsDelayedDelivery()} is false
     */
    void sendDelayed(JobMessage message, Duration delay);

    /**
     * Whether retries must be re-sent through the transport. When false, retries are picked up by polling
     * {@code next_attempt_at}.
     *
     * @return true if {@link #sendDelayed} is available
     */
    boolean supportsDelayedDelivery();

    /**
     * Forwards a dead-letter message to the dead-letter queue.
     *
     * @param message dead-letter message
     * @throws QueueTransportException when forwarding failed
     */
    void sendToDeadLetter(DeadLetterMessage message);
}
