package com.github.dimitryivaniuta.gateway.jobs.service.exception;

/**
 * The queue transport failed to deliver or dead-letter a message (network error, rejected credentials, bad
 * queue name).
 *
 * <p>Never rolls back the already persisted job row.</p>
 */
public class QueueTransportException extends RuntimeException {

    private final Integer httpStatus;

    public QueueTransportException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    /**
     * Status code returned by the queue API, if a response was received.
     *
     * @return http status or null
     */
    public Integer getHttpStatus() {
        return httpStatus;
    }
}
