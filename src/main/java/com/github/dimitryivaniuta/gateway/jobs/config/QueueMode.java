package com.github.dimitryivaniuta.gateway.jobs.config;

/**
 * Queue transport selection.
 */
public enum QueueMode {
    /** Delivery by the DB polling worker; no external credentials. */
    LOCAL,
    /** Delivery through the managed queue HTTP API. */
    EXTERNAL
}
