package com.github.dimitryivaniuta.gateway.jobs.service;

import com.github.dimitryivaniuta.gateway.jobs.config.AppProperties;
import com.github.dimitryivaniuta.gateway.jobs.domain.DeadLetterRecord;
import com.github.dimitryivaniuta.gateway.jobs.domain.FailureKind;
import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import com.github.dimitryivaniuta.gateway.jobs.repo.DeadLetterRecordRepository;
import com.github.dimitryivaniuta.gateway.jobs.repo.JobRepository;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.JobPage;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobConflictException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobNotDueException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobNotFoundException;
import com.github.dimitryivaniuta.gateway.jobs.service.exception.JobValidationException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable job state. Postgres is the source of truth.
 *
 * <p>Every transition is a single conditional update; a losing caller gets a {@link JobConflictException}
 * carrying the status it lost to.</p>
 */
@Service
public class JobStore {

    static final int MAX_PAGE_SIZE = 100;
    private static final String JOB = "Job";

    private final JobRepository jobRepository;
    private final DeadLetterRecordRepository deadLetterRecordRepository;
    private final Clock clock;
    private final Duration claimClockSkew;

    /**
     * Creates the store.
     *
     * @param jobRepository job repository
     * @param deadLetterRecordRepository dead-letter repository
     * @param clock clock
     * @param properties app properties
     */
    public JobStore(JobRepository jobRepository, DeadLetterRecordRepository deadLetterRecordRepository, Clock clock,
                    AppProperties properties) {
        this.jobRepository = jobRepository;
        this.deadLetterRecordRepository = deadLetterRecordRepository;
        this.clock = clock;
        this.claimClockSkew = properties.getJobs().getClaimClockSkew();
    }

    /**
     * Creates a pending job from a wire job type.
     *
     * @param jobType wire name, e.g. {@code ingest_text}
     * @param userId owner
     * @param payloadJson handler input
     * @param documentId optional artifact reference
     * @return stored job
     */
    @Transactional
    public Job create(String jobType, String userId, String payloadJson, String documentId) {
        JobType type = JobType.fromWire(jobType)
                .orElseThrow(() -> new JobValidationException("Unknown job type '" + jobType + "'"));
        return create(type, userId, payloadJson, documentId, null);
    }

    @Transactional
    public Job create(JobType jobType, String userId, String payloadJson, String documentId, String replayOf) {
        if (jobType == null) {
            throw new JobValidationException("jobType is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new JobValidationException("userId is required");
        }
        if (payloadJson == null) {
            throw new JobValidationException("payload is required");
        }
        Job job = Job.newPending(jobType, userId.trim(), blankToNull(documentId), payloadJson, replayOf, now());
        return jobRepository.save(job);
    }

    @Transactional(readOnly = true)
    public Job get(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(JOB, jobId));
    }

    /**
     * Lists a user's jobs newest first.
     *
     * @param userId owner
     * @param limit page size, clamped to 1..100
     * @param cursor cursor from the previous page, or null
     * @return page
     */
    @Transactional(readOnly = true)
    public JobPage list(String userId, int limit, String cursor) {
        if (userId == null || userId.isBlank()) {
            throw new JobValidationException("userId is required");
        }
        int size = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        PageRequest page = PageRequest.of(0, size + 1);

        List<Job> rows;
        if (cursor == null || cursor.isBlank()) {
            rows = jobRepository.findFirstPage(userId, page);
        } else {
            Cursor c = Cursor.decode(cursor);
            rows = jobRepository.findPageAfter(userId, c.createdAt(), c.id(), page);
        }

        if (rows.size() <= size) {
            return new JobPage(rows, null);
        }
        List<Job> items = rows.subList(0, size);
        Job last = items.get(size - 1);
        return new JobPage(List.copyOf(items), new Cursor(last.getCreatedAt(), last.getId()).encode());
    }

    /**
     * Claims a pending job whose retry gate has passed and counts the attempt.
     *
     * @param jobId job id
     * @return claimed job
     * @throws JobNotFoundException unknown job
     * @throws JobNotDueException job is pending but {@code next_attempt_at} is still ahead
     * @throws JobConflictException job is not pending (already claimed, finished or cancelled)
     */
    @Transactional
    public Job markProcessing(String jobId) {
        Instant now = now();
        int updated = jobRepository.claim(jobId, JobStatus.PENDING, JobStatus.PROCESSING, now.plus(claimClockSkew), now);
        if (updated == 0) {
            Job current = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(JOB, jobId));
            if (current.getStatus() == JobStatus.PENDING && current.getNextAttemptAt() != null) {
                throw new JobNotDueException(jobId, current.getNextAttemptAt());
            }
            throw new JobConflictException(jobId, current.getStatus(), "claim");
        }
        return get(jobId);
    }

    @Transactional
    public Job markCompleted(String jobId, String outputJson) {
        int updated = jobRepository.complete(jobId, JobStatus.PROCESSING, JobStatus.COMPLETED, outputJson, now());
        if (updated == 0) {
            throw conflictOrNotFound(jobId, "complete");
        }
        return get(jobId);
    }

    /**
     * Re-queues a processing job; it becomes due again at {@code nextAttemptAt}.
     *
     * @param jobId job id
     * @param error last error
     * @param nextAttemptAt retry gate
     * @return re-queued job
     */
    @Transactional
    public Job markRetry(String jobId, String error, Instant nextAttemptAt) {
        int updated = jobRepository.requeue(jobId, JobStatus.PROCESSING, JobStatus.PENDING, error, nextAttemptAt, now());
        if (updated == 0) {
            throw conflictOrNotFound(jobId, "retry");
        }
        return get(jobId);
    }

    /**
     * Fails a processing job and writes its dead-letter record in the same transaction.
     *
     * @param jobId job id
     * @param error last error
     * @param kind failure kind
     * @return dead-letter record
     */
    @Transactional
    public DeadLetterRecord markFailed(String jobId, String error, FailureKind kind) {
        Instant now = now();
        int updated = jobRepository.fail(jobId, JobStatus.PROCESSING, JobStatus.FAILED, error, now);
        if (updated == 0) {
            throw conflictOrNotFound(jobId, "fail");
        }
        Job failed = get(jobId);
        return deadLetterRecordRepository.save(DeadLetterRecord.forJob(failed, error, kind, now));
    }

    /**
     * Cancels a pending or processing job. A running handler is not interrupted; its result is discarded.
     *
     * @param jobId job id
     * @return cancelled job
     */
    @Transactional
    public Job cancel(String jobId) {
        int updated = jobRepository.cancel(jobId, List.of(JobStatus.PENDING, JobStatus.PROCESSING),
                JobStatus.CANCELLED, now());
        if (updated == 0) {
            throw conflictOrNotFound(jobId, "cancel");
        }
        return get(jobId);
    }

    @Transactional(readOnly = true)
    public JobStatus currentStatus(String jobId) {
        return jobRepository.findStatusById(jobId).orElseThrow(() -> new JobNotFoundException(JOB, jobId));
    }

    @Transactional(readOnly = true)
    public List<Job> findDue(Instant now, int limit) {
        return jobRepository.findDue(JobStatus.PENDING, now, PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public List<Job> findStalledProcessing(Instant cutoff, int limit) {
        return jobRepository.findStalled(JobStatus.PROCESSING, cutoff, PageRequest.of(0, Math.max(1, limit)));
    }

    /**
     * Job counts per status for a user; statuses without jobs are reported as 0.
     *
     * @param userId owner
     * @return counts in status order
     */
    @Transactional(readOnly = true)
    public Map<JobStatus, Long> stats(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new JobValidationException("userId is required");
        }
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, 0L);
        }
        for (JobRepository.StatusCount row : jobRepository.countByStatus(userId)) {
            counts.put(row.getStatus(), row.getTotal());
        }
        return counts;
    }

    private RuntimeException conflictOrNotFound(String jobId, String attempted) {
        return jobRepository.findStatusById(jobId)
                .<RuntimeException>map(status -> new JobConflictException(jobId, status, attempted))
                .orElseGet(() -> new JobNotFoundException(JOB, jobId));
    }

    // Postgres keeps microseconds; truncating keeps cursor comparisons exact.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    /**
     * Keyset position {@code (createdAt, id)}, encoded as URL-safe Base64 of {@code "<instant>|<id>"}.
     */
    record Cursor(Instant createdAt, String id) {

        String encode() {
            String raw = createdAt.toString() + "|" + id;
            return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
        }

        static Cursor decode(String cursor) {
            try {
                String raw = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
                int sep = raw.indexOf('|');
                if (sep <= 0 || sep == raw.length() - 1) {
                    throw new JobValidationException("Invalid cursor");
                }
                return new Cursor(Instant.parse(raw.substring(0, sep)), raw.substring(sep + 1));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                throw new JobValidationException("Invalid cursor", e);
            }
        }
    }
}
