package com.github.dimitryivaniuta.gateway.jobs.web;

import com.github.dimitryivaniuta.gateway.jobs.service.JobProducer;
import com.github.dimitryivaniuta.gateway.jobs.service.JobQueryService;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.EnqueueResult;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.EnqueueJobRequest;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.EnqueueResponse;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.JobPageResponse;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.JobResponse;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.JobStatsResponse;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for jobs.
 */
@RestController
@RequestMapping("/api/jobs")
public class JobsController {

    private final JobProducer producer;
    private final JobQueryService queryService;

    /**
     * Creates the controller.
     *
     * @param producer job producer
     * @param queryService read side
     */
    public JobsController(JobProducer producer, JobQueryService queryService) {
        this.producer = producer;
        this.queryService = queryService;
    }

    /**
     * Enqueues a job. Returns 202 even when the queue send failed ({@code dispatched=false}); the job is stored
     * and stays pending.
     *
     * @param request request
     * @return accepted job
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EnqueueResponse> enqueue(@Valid @RequestBody EnqueueJobRequest request) {
        EnqueueResult result = producer.enqueue(request.jobType(), request.userId(), request.payload(), request.documentId());
        return ResponseEntity.accepted()
                .location(URI.create("/api/jobs/" + result.jobId()))
                .body(EnqueueResponse.from(result));
    }

    @GetMapping(value = "/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public JobResponse get(@PathVariable String jobId) {
        return queryService.get(jobId);
    }

    /**
     * Lists a user's jobs, newest first.
     *
     * @param userId owner
     * @param limit page size (1..100)
     * @param cursor {@code nextCursor} of the previous page
     * @return page
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public JobPageResponse list(
            @RequestParam String userId,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String cursor
    ) {
        return queryService.list(userId, limit, cursor);
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public JobStatsResponse stats(@RequestParam String userId) {
        return queryService.stats(userId);
    }

    @PostMapping(value = "/{jobId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public JobResponse cancel(@PathVariable String jobId) {
        return queryService.cancel(jobId);
    }
}
