package com.github.dimitryivaniuta.gateway.jobs.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Durable job record; the single source of truth for a job's state.
 *
 * <p>State transitions are never done by mutating a loaded entity. They go through conditional single-row updates
 * in {@link com.github.dimitryivaniuta.gateway.jobs.repo.JobRepository}, so two consumers racing on the same row
 * cannot both win:
 * <pre>
 *   PENDING -&gt; PROCESSING -&gt; COMPLETED | FAILED | CANCELLED
 *   PROCESSING -&gt; PENDING   (retry re-queue, attempt count kept)
 * </pre>
 */
@Entity
@Table(
        name = "jobs",
        indexes = {
                @Index(name = "idx_jobs_status_next_created", columnList = "status,next_attempt_at,created_at"),
                @Index(name = "idx_jobs_user_created", columnList = "user_id,created_at,id")
        }
)
@Getter
@Setter
@NoArgsConstructor
public class Job {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false, updatable = false, length = 32)
    private JobType jobType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JobStatus status;

    @Column(name = "user_id", nullable = false, updatable = false, length = 128)
    private String userId;

    @Column(name = "document_id", updatable = false, length = 128)
    private String documentId;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "text")
    private String payload;

    @Column(name = "output", columnDefinition = "text")
    private String output;

    @Column(name = "error", columnDefinition = "text")
    private String error;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "replay_of", updatable = false, length = 36)
    private String replayOf;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    /**
     * Creates a new pending job with zero attempts.
     *
     * @param jobType job type
     * @param userId owner
     * @param documentId optional artifact reference
     * @param payloadJson handler input as JSON
     * @param replayOf id of the failed job this one replays, or null
     * @param now creation time
     * @return job
     */
    public static Job newPending(JobType jobType, String userId, String documentId, String payloadJson,
                                 String replayOf, Instant now) {
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(payloadJson, "payloadJson");

        Job j = new Job();
        j.id = UUID.randomUUID().toString();
        j.jobType = jobType;
        j.status = JobStatus.PENDING;
        j.userId = userId;
        j.documentId = documentId;
        j.payload = payloadJson;
        j.attemptCount = 0;
        j.replayOf = replayOf;
        j.createdAt = now;
        j.updatedAt = now;
        return j;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
