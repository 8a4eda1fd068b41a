package com.github.dimitryivaniuta.gateway.jobs.web;

import com.github.dimitryivaniuta.gateway.jobs.service.DeadLetterService;
import com.github.dimitryivaniuta.gateway.jobs.service.dto.EnqueueResult;
import com.github.dimitryivaniuta.gateway.jobs.service.message.JobMessageCodec;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.DeadLetterResponse;
import com.github.dimitryivaniuta.gateway.jobs.web.dto.EnqueueResponse;
import java.net.URI;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator API for dead-lettered jobs.
 */
@RestController
@RequestMapping("/api/dead-letters")
public class DeadLettersController {

    private final DeadLetterService deadLetterService;
    private final JobMessageCodec codec;

    public DeadLettersController(DeadLetterService deadLetterService, JobMessageCodec codec) {
        this.deadLetterService = deadLetterService;
        this.codec = codec;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<DeadLetterResponse> list(
            @RequestParam(required = false) String userId,
            @RequestParam(defaultValue = "20") int limit
    ) {
        return deadLetterService.list(userId, limit).stream()
                .map(r -> DeadLetterResponse.from(r, codec))
                .toList();
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public DeadLetterResponse get(@PathVariable String id) {
        return DeadLetterResponse.from(deadLetterService.get(id), codec);
    }

    /**
     * Replays a dead-lettered job as a new job.
     *
     * @param id dead-letter record id
     * @return the new job
     */
    @PostMapping(value = "/{id}/replay", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<EnqueueResponse> replay(@PathVariable String id) {
        EnqueueResult result = deadLetterService.replay(id);
        return ResponseEntity.accepted()
                .location(URI.create("/api/jobs/" + result.jobId()))
                .body(EnqueueResponse.from(result));
    }
}
