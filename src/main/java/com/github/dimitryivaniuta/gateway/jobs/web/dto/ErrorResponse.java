package com.github.dimitryivaniuta.gateway.jobs.web.dto;

import java.time.Instant;

/**
 * Generic error response.
 *
 * @param code machine-readable code ({@code VALIDATION_ERROR}, {@code NOT_FOUND}, {@code CONFLICT}, ...)
 * @param message human readable message
 * @param timestamp event time
 */
public record ErrorResponse(String code, String message, Instant timestamp) {}
