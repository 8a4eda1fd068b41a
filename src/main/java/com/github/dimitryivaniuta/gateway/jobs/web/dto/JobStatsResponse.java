package com.github.dimitryivaniuta.gateway.jobs.web.dto;

import java.util.Map;

/**
 * Job counts per status.
 *
 * @param userId owner
 * @param counts status wire name to count
 * @param total all jobs of the user
 */
public record JobStatsResponse(String userId, Map<String, Long> counts, long total) {}
