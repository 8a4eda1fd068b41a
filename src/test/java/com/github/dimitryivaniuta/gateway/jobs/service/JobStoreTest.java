package com.github.dimitryivaniuta.gateway.jobs.service;

import com.github.dimitryivaniuta.gateway.jobs.PostgresIntegrationTestBase;
import com.github.dimitryivaniuta.gateway.jobs.domain.DeadLetterRecord;
import com.github.dimitryivaniuta.gateway.jobs.domain.FailureKind;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import com.github.dimitryivaniuta.gateway.jobs.repo.DeadLetterRecordRepository;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.JobPage;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobConflictException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobNotDueException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobNotFoundException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobValidationException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Job store transitions against a real Postgres.
 */
class JobStoreTest extends PostgresIntegrationTestBase {

    @Autowired
    JobStore jobStore;

    @Autowired
    DeadLetterRecordRepository deadLetterRecordRepository;

    @Test
    void createdJobIsPendingWithZeroAttempts() {
        Job job = jobStore.create("ingest_text", user(), "{\"text\":\"hi\"}", "doc-1");

        Job loaded = jobStore.get(job.getId());
        Assertions.assertEquals(JobStatus.PENDING, loaded.getStatus());
        Assertions.assertEquals(0, loaded.getAttemptCount());
        Assertions.assertEquals(JobType.INGEST_TEXT, loaded.getJobType());
        Assertions.assertEquals("doc-1", loaded.getDocumentId());
    }

    @Test
    void createRejectsUnknownTypeAndBlankUser() {
        Assertions.assertThrows(JobValidationException.class, () -> jobStore.create("transcode_video", user(), "{}", null));
        Assertions.assertThrows(JobValidationException.class, () -> jobStore.create("ingest_text", " ", "{}", null));
    }

    @Test
    void concurrentClaimHasExactlyOneWinner() throws Exception {
        Job job = jobStore.create("ingest_youtube", user(), "{}", null);

        int contenders = 8;
        ExecutorService exec = Executors.newFixedThreadPool(contenders);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            results.add(exec.submit(() -> {
                go.await(5, TimeUnit.SECONDS);
                try {
                    jobStore.markProcessing(job.getId());
                    return true;
                } catch (JobConflictException e) {
                    Assertions.assertEquals(JobStatus.PROCESSING, e.getCurrentStatus());
                    return false;
                }
            }));
        }
        go.countDown();

        int winners = 0;
        for (Future<Boolean> f : results) {
            if (f.get(10, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        exec.shutdown();

        Assertions.assertEquals(1, winners, "Exactly one consumer must win the claim");
        Assertions.assertEquals(1, jobStore.get(job.getId()).getAttemptCount());
    }

    @Test
    void attemptCountGrowsByOnePerClaim() {
        Job job = jobStore.create("ingest_text", user(), "{}", null);

        jobStore.markProcessing(job.getId());
        jobStore.markRetry(job.getId(), "flaky", Instant.now());
        Job second = jobStore.markProcessing(job.getId());

        Assertions.assertEquals(2, second.getAttemptCount());
        Assertions.assertEquals("flaky", second.getError());
    }

    @Test
    void claimBeforeRetryGateIsRejectedAsNotDue() {
        Job job = jobStore.create("ingest_text", user(), "{}", null);
        jobStore.markProcessing(job.getId());
        Instant gate = Instant.now().plusSeconds(60);
        jobStore.markRetry(job.getId(), "rate limited", gate);

        JobNotDueException e = Assertions.assertThrows(JobNotDueException.class,
                () -> jobStore.markProcessing(job.getId()));

        Assertions.assertEquals(gate.truncatedTo(ChronoUnit.MILLIS), e.getNextAttemptAt().truncatedTo(ChronoUnit.MILLIS));
        Job loaded = jobStore.get(job.getId());
        Assertions.assertEquals(JobStatus.PENDING, loaded.getStatus());
        Assertions.assertEquals(1, loaded.getAttemptCount());
    }

    @Test
    void claimWithinClockSkewOfRetryGateSucceeds() {
        Job job = jobStore.create("ingest_text", user(), "{}", null);
        jobStore.markProcessing(job.getId());
        jobStore.markRetry(job.getId(), "rate limited", Instant.now().plusMillis(200));

        Assertions.assertEquals(2, jobStore.markProcessing(job.getId()).getAttemptCount());
    }

    @Test
    void completedJobRejectsSecondCompletionAndKeepsOutput() {
        Job job = jobStore.create("generate_blog", user(), "{}", null);
        jobStore.markProcessing(job.getId());
        jobStore.markCompleted(job.getId(), "{\"title\":\"first\"}");

        JobConflictException e = Assertions.assertThrows(JobConflictException.class,
                () -> jobStore.markCompleted(job.getId(), "{\"title\":\"second\"}"));

        Assertions.assertEquals(JobStatus.COMPLETED, e.getCurrentStatus());
        Job loaded = jobStore.get(job.getId());
        Assertions.assertEquals("{\"title\":\"first\"}", loaded.getOutput());
        Assertions.assertNotNull(loaded.getCompletedAt());
    }

    @Test
    void markFailedWritesExactlyOneDeadLetterRecord() {
        Job job = jobStore.create("ingest_drive", user(), "{\"folder\":\"f\"}", "doc-9");
        jobStore.markProcessing(job.getId());

        DeadLetterRecord record = jobStore.markFailed(job.getId(), "invalid input", FailureKind.FATAL);

        Assertions.assertEquals(job.getId(), record.getJobId());
        Assertions.assertEquals(1, record.getAttemptCount());
        Assertions.assertEquals("ingest_drive", record.getJobType());
        Assertions.assertEquals(JobStatus.FAILED, jobStore.currentStatus(job.getId()));
        Assertions.assertThrows(JobConflictException.class,
                () -> jobStore.markFailed(job.getId(), "again", FailureKind.FATAL));
        Assertions.assertEquals(1, deadLetterRecordRepository.countByJobId(job.getId()));
    }

    @Test
    void cancelIsRejectedForTerminalJobs() {
        Job pending = jobStore.create("ingest_text", user(), "{}", null);
        Assertions.assertEquals(JobStatus.CANCELLED, jobStore.cancel(pending.getId()).getStatus());

        JobConflictException e = Assertions.assertThrows(JobConflictException.class, () -> jobStore.cancel(pending.getId()));
        Assertions.assertEquals(JobStatus.CANCELLED, e.getCurrentStatus());

        JobConflictException claim = Assertions.assertThrows(JobConflictException.class,
                () -> jobStore.markProcessing(pending.getId()));
        Assertions.assertEquals(JobStatus.CANCELLED, claim.getCurrentStatus());
    }

    @Test
    void processingJobCanBeCancelled() {
        Job job = jobStore.create("ingest_text", user(), "{}", null);
        jobStore.markProcessing(job.getId());

        Assertions.assertEquals(JobStatus.CANCELLED, jobStore.cancel(job.getId()).getStatus());
        Assertions.assertThrows(JobConflictException.class, () -> jobStore.markCompleted(job.getId(), "{}"));
    }

    @Test
    void unknownJobIsNotFound() {
        String id = UUID.randomUUID().toString();
        Assertions.assertThrows(JobNotFoundException.class, () -> jobStore.get(id));
        Assertions.assertThrows(JobNotFoundException.class, () -> jobStore.markProcessing(id));
        Assertions.assertThrows(JobNotFoundException.class, () -> jobStore.cancel(id));
    }

    @Test
    void retryGateHidesJobUntilNextAttemptAt() {
        Job job = jobStore.create("ingest_text", user(), "{}", null);
        jobStore.markProcessing(job.getId());
        Instant gate = Instant.now().plusSeconds(60);
        jobStore.markRetry(job.getId(), "later", gate);

        Assertions.assertFalse(dueIds(Instant.now()).contains(job.getId()));
        Assertions.assertTrue(dueIds(gate.plusSeconds(1)).contains(job.getId()));
    }

    @Test
    void stalledProcessingJobsAreFound() {
        Job job = jobStore.create("ingest_text", user(), "{}", null);
        jobStore.markProcessing(job.getId());

        List<Job> stalled = jobStore.findStalledProcessing(Instant.now().plusSeconds(1), 500);

        Assertions.assertTrue(stalled.stream().anyMatch(j -> j.getId().equals(job.getId())));
    }

    @Test
    void listPagesThroughAllJobsNewestFirst() {
        String user = user();
        Set<String> created = new HashSet<>();
        for (int i = 0; i < 7; i++) {
            created.add(jobStore.create("ingest_text", user, "{\"n\":" + i + "}", null).getId());
        }

        List<Job> seen = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        do {
            JobPage page = jobStore.list(user, 3, cursor);
            seen.addAll(page.items());
            cursor = page.nextCursor();
            pages++;
        } while (cursor != null);

        Assertions.assertEquals(3, pages);
        Assertions.assertEquals(created, new HashSet<>(seen.stream().map(Job::getId).toList()));
        for (int i = 1; i < seen.size(); i++) {
            Assertions.assertFalse(seen.get(i).getCreatedAt().isAfter(seen.get(i - 1).getCreatedAt()));
        }
    }

    @Test
    void invalidCursorIsRejected() {
        Assertions.assertThrows(JobValidationException.class, () -> jobStore.list(user(), 10, "%%%"));
        Assertions.assertThrows(JobValidationException.class, () -> jobStore.list(user(), 10, "bm90LWEtY3Vyc29y"));
    }

    @Test
    void statsCountEveryStatus() {
        String user = user();
        Job a = jobStore.create("ingest_text", user, "{}", null);
        jobStore.create("ingest_text", user, "{}", null);
        jobStore.cancel(a.getId());

        Map<JobStatus, Long> stats = jobStore.stats(user);

        Assertions.assertEquals(1L, stats.get(JobStatus.PENDING));
        Assertions.assertEquals(1L, stats.get(JobStatus.CANCELLED));
        Assertions.assertEquals(0L, stats.get(JobStatus.COMPLETED));
        Assertions.assertEquals(JobStatus.values().length, stats.size());
    }

    private Set<String> dueIds(Instant now) {
        Set<String> ids = new HashSet<>();
        jobStore.findDue(now, 1000).forEach(j -> ids.add(j.getId()));
        return ids;
    }

    private static String user() {
        return "user-" + UUID.randomUUID();
    }
}
