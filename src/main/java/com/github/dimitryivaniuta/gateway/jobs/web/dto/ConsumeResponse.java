package com.github.dimitryivaniuta.gateway.jobs.web.dto;

import com.github.dimitryivaniuta.gateway.jobs.service.ConsumeOutcome;

/**
 * Outcome of a pushed message.
 *
 * @param index position in the pushed batch (0 for single messages)
 * @param outcome consume outcome
 */
public record ConsumeResponse(int index, ConsumeOutcome outcome) {}
