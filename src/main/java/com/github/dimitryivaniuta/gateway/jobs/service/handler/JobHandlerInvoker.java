package com.github.dimitryivaniuta.gateway.jobs.service.handler;

import com.github.dimitryivaniuta.gateway.jobs.config.AppProperties;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Runs a handler on the handler pool with an upper time bound.
 *
 * <p>The timeout runs from the moment the handler starts; waiting for a pool thread is bounded separately by the
 * same duration. A handler that exceeds the timeout is interrupted and the attempt counts as a retryable failure.
 * A saturated pool and exceptions other than {@link JobHandlerException} are reported as retryable too.</p>
 */
@Component
public class JobHandlerInvoker {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerInvoker.class);

    private final AsyncTaskExecutor executor;
    private final Duration timeout;

    /**
     * Creates the invoker.
     *
     * @param executor handler pool
     * @param properties app properties
     */
    @Autowired
    public JobHandlerInvoker(@Qualifier("jobHandlerExecutor") AsyncTaskExecutor executor, AppProperties properties) {
        this(executor, properties.getJobs().getHandlerTimeout());
    }

    public JobHandlerInvoker(AsyncTaskExecutor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Invokes the handler and waits for it.
     *
     * @param handler handler
     * @param context job input
     * @return handler result
     * @throws JobHandlerException classified failure
     */
    public JobResult invoke(JobHandler handler, JobContext context) throws JobHandlerException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        CountDownLatch started = new CountDownLatch(1);
        Future<JobResult> future;
        try {
            future = executor.submit(() -> {
                started.countDown();
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return handler.handle(context);
                } finally {
                    MDC.clear();
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Handler pool saturated; job {} not started", context.jobId());
            throw new RetryableJobException("Handler pool saturated; handler not started", e);
        }

        try {
            if (!started.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                future.cancel(true);
                throw new RetryableJobException("Handler not started within " + timeout);
            }
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Handler for job {} exceeded {}; interrupted", context.jobId(), timeout);
            throw new RetryableJobException("Handler timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RetryableJobException("Interrupted while waiting for handler", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof JobHandlerException handlerException) {
                throw handlerException;
            }
            String msg = cause == null ? e.getMessage() : cause.getClass().getSimpleName() + ": " + cause.getMessage();
            throw new RetryableJobException("Unclassified handler error: " + msg, cause);
        }
    }
}
