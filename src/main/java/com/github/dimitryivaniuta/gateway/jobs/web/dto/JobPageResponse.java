package com.github.dimitryivaniuta.gateway.jobs.web.dto;

import java.util.List;

/**
 * Page of jobs.
 *
 * @param items jobs, newest first
 * @param nextCursor pass as {@code cursor} to fetch the next page; null on the last page
 */
public record JobPageResponse(List<JobResponse> items, String nextCursor) {}
