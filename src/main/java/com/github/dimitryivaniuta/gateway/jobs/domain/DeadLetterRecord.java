package com.github.dimitryivaniuta.gateway.jobs.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Terminal record for a job that failed fatally or exhausted its retries, or for a raw message that could not be
 * parsed at all.
 *
 * <p>Append-only: at most one record per job ({@code uq_dead_letter_job}), never updated, kept for inspection and
 * operator replay.</p>
 */
@Entity
@Immutable
@Table(
        name = "dead_letter_records",
        uniqueConstraints = @UniqueConstraint(name = "uq_dead_letter_job", columnNames = "job_id"),
        indexes = @Index(name = "idx_dead_letter_user_created", columnList = "user_id,created_at")
)
@Getter
@NoArgsConstructor
public class DeadLetterRecord {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    /** Null only for malformed raw messages. */
    @Column(name = "job_id", updatable = false, length = 36)
    private String jobId;

    @Column(name = "user_id", updatable = false, length = 128)
    private String userId;

    @Column(name = "job_type", updatable = false, length = 64)
    private String jobType;

    @Column(name = "document_id", updatable = false, length = 128)
    private String documentId;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "text")
    private String payload;

    @Column(name = "error", nullable = false, updatable = false, columnDefinition = "text")
    private String error;

    @Column(name = "attempt_count", nullable = false, updatable = false)
    private int attemptCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", nullable = false, updatable = false, length = 32)
    private FailureKind failureKind;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Snapshot of a job at the moment it was dead-lettered.
     *
     * @param job failed job (already in FAILED state)
     * @param error last error
     * @param kind failure kind
     * @param now record time
     * @return record
     */
    public static DeadLetterRecord forJob(Job job, String error, FailureKind kind, Instant now) {
        DeadLetterRecord r = new DeadLetterRecord();
        r.id = UUID.randomUUID().toString();
        r.jobId = job.getId();
        r.userId = job.getUserId();
        r.jobType = job.getJobType().wireName();
        r.documentId = job.getDocumentId();
        r.payload = job.getPayload();
        r.error = error;
        r.attemptCount = job.getAttemptCount();
        r.failureKind = kind;
        r.createdAt = now;
        return r;
    }

    /**
     * Record for a message that never mapped onto a job.
     *
     * @param rawMessage message body as received
     * @param reason why it was rejected
     * @param now record time
     * @return record
     */
    public static DeadLetterRecord forRawMessage(String rawMessage, String reason, Instant now) {
        DeadLetterRecord r = new DeadLetterRecord();
        r.id = UUID.randomUUID().toString();
        r.payload = rawMessage == null ? "" : rawMessage;
        r.error = reason;
        r.attemptCount = 0;
        r.failureKind = FailureKind.MALFORMED_MESSAGE;
        r.createdAt = now;
        return r;
    }
}
