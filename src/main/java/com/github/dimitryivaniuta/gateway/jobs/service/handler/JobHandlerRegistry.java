package com.github.dimitryivaniuta.gateway.jobs.service.handler;

import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Job type to handler mapping, built once at startup from all {@link JobHandler} beans.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<JobType, JobHandler> handlers;

    /**
     * Builds the registry.
     *
     * @param handlers all handler beans (may be empty)
     * @throws IllegalStateException when two handlers claim the same job type
     */
    public JobHandlerRegistry(List<JobHandler> handlers) {
        Map<JobType, JobHandler> map = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            for (JobType type : handler.handledTypes()) {
                JobHandler previous = map.putIfAbsent(type, handler);
                if (previous != null) {
                    throw new IllegalStateException("Job type '" + type.wireName() + "' is handled by both "
                            + previous.getClass().getName() + " and " + handler.getClass().getName());
                }
            }
        }
        this.handlers = Collections.unmodifiableMap(map);

        List<String> missing = Arrays.stream(JobType.values())
                .filter(t -> !map.containsKey(t))
                .map(JobType::wireName)
                .toList();
        if (!missing.isEmpty()) {
            log.warn("No handler registered for job types {}; such jobs will be dead-lettered", missing);
        }
        log.info("Job handler registry initialized with {} types", map.size());
    }

    public Optional<JobHandler> find(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }
}
