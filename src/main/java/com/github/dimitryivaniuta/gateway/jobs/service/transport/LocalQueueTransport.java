package com.github.dimitryivaniuta.gateway.jobs.service.transport;

import com.github.dimitryivaniuta.gateway.jobs.config.QueueMode;
import com.github.dimitryivaniuta.gateway.jobs.service.message.DeadLetterMessage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessage;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Local (development) mode: the pending row is the message.
 *
 * <p>Jobs are delivered by {@link com.github.dimitryivaniuta.gateway.jobs.service.LocalJobPoller}, retries by
 * polling {@code next_attempt_at}, and dead letters already live in the same database.</p>
 */
@Slf4j
public class LocalQueueTransport implements QueueTransport {

    @Override
    public QueueMode mode() {
        return QueueMode.LOCAL;
    }

    @Override
    public void send(JobMessage message) {
        log.debug("Local queue mode: job {} left pending for the polling worker", message.jobId());
    }

    @Override
    public void sendDelayed(JobMessage message, Duration delay) {
        throw new UnsupportedOperationException("Local queue mode re-delivers retries by polling next_attempt_at");
    }

    @Override
    public boolean supportsDelayedDelivery() {
        return false;
    }

    @Override
    public void sendToDeadLetter(DeadLetterMessage message) {
        log.debug("Local queue mode: dead letter for job {} kept in dead_letter_records only", message.jobId());
    }
}
