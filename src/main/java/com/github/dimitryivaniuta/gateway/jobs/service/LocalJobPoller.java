package com.github.dimitryivaniuta.gateway.jobs.service;

import com.github.dimitryivaniuta.gateway.jobs.config.AppProperties;
import com.github.dimitryivaniuta.gateway.jobs.config.QueueMode;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import com.github.dimitryivaniuta.gateway.jobs.service.transport.QueueTransport;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Database polling worker.
 *
 * <p>Delivers due pending jobs to the {@link JobConsumer}, one independent task per job, and re-queues
 * jobs stuck in processing. Several pollers may run at once; the claim decides which one runs a job.
 * Enabled only by {@code app.worker.enabled=true}.</p>
 */
@Component
@ConditionalOnProperty(prefix = "app.worker", name = "enabled", havingValue = "true")
public class LocalJobPoller {

    private static final Logger log = LoggerFactory.getLogger(LocalJobPoller.class);

    private final JobStore jobStore;
    private final JobConsumer consumer;
    private final JobMessageCodec codec;
    private final QueueTransport transport;
    private final AppProperties properties;
    private final Executor executor;
    private final Clock clock;

    public LocalJobPoller(
            JobStore jobStore,
            JobConsumer consumer,
            JobMessageCodec codec,
            QueueTransport transport,
            AppProperties properties,
            @Qualifier("jobWorkerExecutor") Executor executor,
            Clock clock
    ) {
        this.jobStore = jobStore;
        this.consumer = consumer;
        this.codec = codec;
        this.transport = transport;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Startup drain of jobs left pending while no worker was running.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (transport.mode() == QueueMode.EXTERNAL) {
            log.warn("Polling worker enabled with QUEUE_MODE=external: it will also run jobs whose queue send failed. "
                    + "See {}", AppProperties.QUEUE_SETUP_DOC);
        }
        AppProperties.Worker worker = properties.getWorker();
        if (worker.isRecoverOnStartup()) {
            int drained = drain(worker.getRecoverBatchSize());
            log.info("Startup recovery processed {} pending jobs", drained);
        }
    }

    @Scheduled(fixedDelayString = "${app.worker.poll-interval-ms:1000}")
    public void poll() {
        pollOnce();
    }

    /**
     * Runs one batch of due jobs and waits for all of them.
     *
     * @return number of jobs handed to the consumer
     */
    public int pollOnce() {
        return drain(properties.getWorker().getBatchSize());
    }

    /**
     * Re-queues (or dead-letters) jobs that stayed in processing longer than {@code stale-processing-after}.
     *
     * @return number of stalled jobs resolved
     */
    @Scheduled(fixedDelayString = "${app.worker.stale-check-interval-ms:60000}")
    public int recoverStalled() {
        AppProperties.Worker worker = properties.getWorker();
        Instant cutoff = clock.instant().minus(worker.getStaleProcessingAfter());
        List<Job> stalled = jobStore.findStalledProcessing(cutoff, worker.getBatchSize());
        for (Job job : stalled) {
            consumer.resolveStalled(job);
        }
        if (!stalled.isEmpty()) {
            log.warn("Recovered {} stalled jobs (cutoff={})", stalled.size(), cutoff);
        }
        return stalled.size();
    }

    private int drain(int limit) {
        List<Job> due = jobStore.findDue(clock.instant(), limit);
        if (due.isEmpty()) {
            return 0;
        }

        CompletableFuture<?>[] tasks = due.stream()
                .map(job -> CompletableFuture.runAsync(() -> consumer.handle(codec.fromJob(job)), executor))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(tasks).join();
        } catch (CompletionException e) {
            log.error("Poll batch finished with a failed task", e.getCause());
        }
        log.debug("Poll batch done. jobs={}", due.size());
        return due.size();
    }
}
