package com.github.dimitryivaniuta.gateway.jobs.service.exception;

/**
 * No job (or dead-letter record) with the requested id.
 */
public class JobNotFoundException extends RuntimeException {

    private final String id;

    public JobNotFoundException(String kind, String id) {
        super(kind + " '" + id + "' not found");
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
