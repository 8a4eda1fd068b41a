package com.github.dimitryivaniuta.gateway.jobs.repo;

import com.github.dimitryivaniuta.gateway.jobs.domain.DeadLetterRecord;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link DeadLetterRecord}.
 */
public interface DeadLetterRecordRepository extends JpaRepository<DeadLetterRecord, String> {

    Optional<DeadLetterRecord> findByJobId(String jobId);

    long countByJobId(String jobId);

    List<DeadLetterRecord> findByUserIdOrderByCreatedAtDesc(String userId, Pageable page);

    List<DeadLetterRecord> findAllByOrderByCreatedAtDesc(Pageable page);
}
