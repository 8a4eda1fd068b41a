package com.github.dimitryivaniuta.gateway.jobs.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * Enumerated job types. The wire name selects the handler.
 */
public enum JobType {
    INGEST_YOUTUBE("ingest_youtube"),
    INGEST_TEXT("ingest_text"),
    INGEST_DRIVE("ingest_drive"),
    GENERATE_BLOG("generate_blog"),
    OPTIMIZE_DRIVE("optimize_drive"),
    DRIVE_CHANGE_POLL("drive_change_poll"),
    DRIVE_WATCH_RENEWAL("drive_watch_renewal");

    private final String wireName;

    JobType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in queue messages and on the API.
     *
     * @return wire name, e.g. {@code ingest_youtube}
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name (exact match, surrounding whitespace ignored).
     *
     * @param value wire name
     * @return job type, empty when unknown
     */
    public static Optional<JobType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim();
        return Arrays.stream(values()).filter(t -> t.wireName.equals(v)).findFirst();
    }
}
