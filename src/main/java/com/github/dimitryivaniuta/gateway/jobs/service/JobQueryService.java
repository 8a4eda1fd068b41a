package com.github.dimitryivaniuta.gateway.jobs.service;

import com.github.dimitryivaniuta.gateway.jobs.domain.JobStatus;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.JobPage;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.JobPageResponse;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.JobResponse;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.JobStatsResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import static com.github.dimitryivaniuta.gateway.jobs.config.CacheConfig.JOB_CACHE;

/**
 * Read side for the API. Terminal job snapshots are cached; Postgres remains the source of truth.
 */
@Service
public class JobQueryService {

    private final JobStore jobStore;
    private final JobMessageCodec codec;

    public JobQueryService(JobStore jobStore, JobMessageCodec codec) {
        this.jobStore = jobStore;
        this.codec = codec;
    }

    /**
     * Gets a job. Only terminal results are cached since they never change again.
     *
     * @param jobId job id
     * @return job view
     */
    @Cacheable(cacheNames = JOB_CACHE, key = "#jobId", unless = "#result == null || !#result.isTerminal()")
    public JobResponse get(String jobId) {
        return JobResponse.from(jobStore.get(jobId), codec);
    }

    public JobPageResponse list(String userId, int limit, String cursor) {
        JobPage page = jobStore.list(userId, limit, cursor);
        return new JobPageResponse(
                page.items().stream().map(j -> JobResponse.from(j, codec)).toList(),
                page.nextCursor()
        );
    }

    public JobResponse cancel(String jobId) {
        return JobResponse.from(jobStore.cancel(jobId), codec);
    }

    public JobStatsResponse stats(String userId) {
        Map<String, Long> counts = new LinkedHashMap<>();
        long total = 0;
        for (Map.Entry<JobStatus, Long> e : jobStore.stats(userId).entrySet()) {
            counts.put(e.getKey().wireName(), e.getValue());
            total += e.getValue();
        }
        return new JobStatsResponse(userId, counts, total);
    }
}
