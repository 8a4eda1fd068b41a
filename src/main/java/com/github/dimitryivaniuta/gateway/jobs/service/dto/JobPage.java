package com.github.dimitryivaniuta.gateway.jobs.service.dto;

import com.github.dimitryivaniuta.gateway.jobs.domain.Job;
import java.util.List;

/**
 * One keyset page of jobs.
 *
 * @param items jobs, newest first
 * @param nextCursor opaque cursor for the next page, null on the last page
 */
public record JobPage(List<Job> items, String nextCursor) {}
