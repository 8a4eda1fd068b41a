package com.github.dimitryivaniuta.gateway.jobs.repo;

import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link Job}.
 *
 * <p>Every state transition is a conditional single-row {@code UPDATE ... WHERE status = :expected}. The returned
 * row count is the compare-and-swap result: 1 means this caller won the transition, 0 means the row was not in the
 * expected state (or does not exist). Postgres re-checks the predicate after a concurrent writer commits, so two
 * callers can never both get 1.</p>
 */
public interface JobRepository extends JpaRepository<Job, String> {

    /**
     * Claims a due job for processing and counts the attempt.
     *
     * @param id job id
     * @param expected required current status (PENDING)
     * @param next new status (PROCESSING)
     * @param notBefore latest {@code nextAttemptAt} that still counts as due (now plus clock-skew allowance)
     * @param now update time
     * @return updated rows (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Job j
               set j.status = :next,
                   j.attemptCount = j.attemptCount + 1,
                   j.updatedAt = :now
             where j.id = :id
               and j.status = :expected
               and (j.nextAttemptAt is null or j.nextAttemptAt <= :notBefore)
            """)
    int claim(@Param("id") String id,
              @Param("expected") JobStatus expected,
              @Param("next") JobStatus next,
              @Param("notBefore") Instant notBefore,
              @Param("now") Instant now);

    /**
     * Stores the output of a successful run.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Job j
               set j.status = :next,
                   j.output = :output,
                   j.error = null,
                   j.nextAttemptAt = null,
                   j.completedAt = :now,
                   j.updatedAt = :now
             where j.id = :id
               and j.status = :expected
            """)
    int complete(@Param("id") String id,
                 @Param("expected") JobStatus expected,
                 @Param("next") JobStatus next,
                 @Param("output") String output,
                 @Param("now") Instant now);

    /**
     * Puts a processing job back to pending with a retry gate.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Job j
               set j.status = :next,
                   j.error = :error,
                   j.nextAttemptAt = :nextAttemptAt,
                   j.updatedAt = :now
             where j.id = :id
               and j.status = :expected
            """)
    int requeue(@Param("id") String id,
                @Param("expected") JobStatus expected,
                @Param("next") JobStatus next,
                @Param("error") String error,
                @Param("nextAttemptAt") Instant nextAttemptAt,
                @Param("now") Instant now);

    /**
     * Moves a processing job to FAILED.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Job j
               set j.status = :next,
                   j.error = :error,
                   j.nextAttemptAt = null,
                   j.completedAt = :now,
                   j.updatedAt = :now
             where j.id = :id
               and j.status = :expected
            """)
    int fail(@Param("id") String id,
             @Param("expected") JobStatus expected,
             @Param("next") JobStatus next,
             @Param("error") String error,
             @Param("now") Instant now);

    /**
     * Cancels a job that has not reached a terminal state.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Job j
               set j.status = :next,
                   j.nextAttemptAt = null,
                   j.completedAt = :now,
                   j.updatedAt = :now
             where j.id = :id
               and j.status in :cancellable
            """)
    int cancel(@Param("id") String id,
               @Param("cancellable") Collection<JobStatus> cancellable,
               @Param("next") JobStatus next,
               @Param("now") Instant now);

    @Query("select j.status from Job j where j.id = :id")
    Optional<JobStatus> findStatusById(@Param("id") String id);

    /**
     * Pending jobs whose retry gate has passed, oldest first.
     *
     * <p>No row locks: several pollers may read the same row, and the later {@link #claim} decides the winner.</p>
     *
     * @param status PENDING
     * @param now current time
     * @param page limit
     * @return due jobs
     */
    @Query("""
            select j from Job j
             where j.status = :status
               and (j.nextAttemptAt is null or j.nextAttemptAt <= :now)
             order by j.createdAt asc
            """)
    List<Job> findDue(@Param("status") JobStatus status, @Param("now") Instant now, Pageable page);

    /**
     * Jobs left in PROCESSING longer than the cutoff (worker crashed or hung past its timeout).
     */
    @Query("""
            select j from Job j
             where j.status = :status
               and j.updatedAt < :cutoff
             order by j.updatedAt asc
            """)
    List<Job> findStalled(@Param("status") JobStatus status, @Param("cutoff") Instant cutoff, Pageable page);

    /**
     * First page of a user's jobs, newest first.
     */
    @Query("""
            select j from Job j
             where j.userId = :userId
             order by j.createdAt desc, j.id desc
            """)
    List<Job> findFirstPage(@Param("userId") String userId, Pageable page);

    /**
     * Keyset page strictly after the (createdAt, id) cursor position.
     */
    @Query("""
            select j from Job j
             where j.userId = :userId
               and (j.createdAt < :createdAt or (j.createdAt = :createdAt and j.id < :id))
             order by j.createdAt desc, j.id desc
            """)
    List<Job> findPageAfter(@Param("userId") String userId,
                            @Param("createdAt") Instant createdAt,
                            @Param("id") String id,
                            Pageable page);

    @Query("select j.status as status, count(j) as total from Job j where j.userId = :userId group by j.status")
    List<StatusCount> countByStatus(@Param("userId") String userId);

    /**
     * Projection for per-status counts.
     */
    interface StatusCount {
        JobStatus getStatus();

        long getTotal();
    }
}
