package com.github.dimitryivaniuta.gateway.jobs.service.handler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.dimitryivaniuta.gateway.jobs.domain.JobType;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class JobHandlerInvokerTest {

    private final ThreadPoolTaskExecutor executor = executor();
    private final JobContext context = new JobContext("j1", "u1", JobType.INGEST_TEXT, null,
            JsonNodeFactory.instance.objectNode().put("text", "hello"), 1);

    @AfterEach
    void shutdown() {
        executor.shutdown();
    }

    @Test
    void returnsHandlerResult() throws Exception {
        JobHandlerInvoker invoker = new JobHandlerInvoker(executor, Duration.ofSeconds(5));

        JobResult result = invoker.invoke(handler(ctx -> JobResult.of(ctx.payload())), context);

        Assertions.assertEquals("hello", result.output().get("text").asText());
    }

    @Test
    void classifiedFailuresPassThrough() {
        JobHandlerInvoker invoker = new JobHandlerInvoker(executor, Duration.ofSeconds(5));

        Assertions.assertThrows(FatalJobException.class,
                () -> invoker.invoke(handler(ctx -> { throw new FatalJobException("bad input"); }), context));
        Assertions.assertThrows(RetryableJobException.class,
                () -> invoker.invoke(handler(ctx -> { throw new RetryableJobException("rate limited"); }), context));
    }

    @Test
    void unclassifiedRuntimeFailureIsRetryable() {
        JobHandlerInvoker invoker = new JobHandlerInvoker(executor, Duration.ofSeconds(5));

        RetryableJobException e = Assertions.assertThrows(RetryableJobException.class,
                () -> invoker.invoke(handler(ctx -> { throw new IllegalStateException("boom"); }), context));
        Assertions.assertTrue(e.getMessage().contains("boom"));
    }

    @Test
    void slowHandlerTimesOutAndIsInterrupted() throws Exception {
        JobHandlerInvoker invoker = new JobHandlerInvoker(executor, Duration.ofMillis(100));
        CountDownLatch interrupted = new CountDownLatch(1);

        RetryableJobException e = Assertions.assertThrows(RetryableJobException.class,
                () -> invoker.invoke(handler(ctx -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException ie) {
                        interrupted.countDown();
                    }
                    return JobResult.empty();
                }), context));

        Assertions.assertTrue(e.getMessage().contains("timed out"));
        Assertions.assertTrue(interrupted.await(5, TimeUnit.SECONDS), "handler thread must be interrupted");
    }

    @Test
    void saturatedPoolIsRetryableInsteadOfRunningOnCaller() throws Exception {
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.setQueueCapacity(0);
        single.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        single.initialize();
        JobHandlerInvoker invoker = new JobHandlerInvoker(single, Duration.ofSeconds(5));
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread busy = new Thread(() -> {
            try {
                invoker.invoke(handler(ctx -> {
                    running.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                    return JobResult.empty();
                }), context);
            } catch (JobHandlerException ignored) {
                // not under test
            }
        });
        busy.start();
        Assertions.assertTrue(running.await(5, TimeUnit.SECONDS));

        long startNanos = System.nanoTime();
        RetryableJobException e = Assertions.assertThrows(RetryableJobException.class,
                () -> invoker.invoke(handler(ctx -> {
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    }
                    return JobResult.empty();
                }), context));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        Assertions.assertTrue(e.getMessage().contains("saturated"));
        Assertions.assertTrue(elapsedMs < 1_000, "rejected handler must not run on the caller, took " + elapsedMs + "ms");
        release.countDown();
        busy.join(5_000);
        single.shutdown();
    }

    @Test
    void timeoutStartsWhenHandlerStarts() throws Exception {
        ThreadPoolTaskExecutor queued = new ThreadPoolTaskExecutor();
        queued.setCorePoolSize(1);
        queued.setMaxPoolSize(1);
        queued.setQueueCapacity(4);
        queued.initialize();
        JobHandlerInvoker invoker = new JobHandlerInvoker(queued, Duration.ofMillis(800));
        JobHandler sleepy = handler(ctx -> {
            try {
                Thread.sleep(500);
            } catch (InterruptedException ie) {
                throw new RetryableJobException("interrupted", ie);
            }
            return JobResult.of(ctx.payload());
        });

        Thread first = new Thread(() -> {
            try {
                invoker.invoke(sleepy, context);
            } catch (JobHandlerException ignored) {
                // not under test
            }
        });
        first.start();
        Thread.sleep(50);

        // waits ~450ms for the thread, then runs 500ms: over 800ms in total, under it once started
        JobResult result = invoker.invoke(sleepy, context);

        Assertions.assertEquals("hello", result.output().get("text").asText());
        first.join(5_000);
        queued.shutdown();
    }

    private static JobHandler handler(Body body) {
        return new JobHandler() {
            @Override
            public Set<JobType> handledTypes() {
                return Set.of(JobType.INGEST_TEXT);
            }

            @Override
            public JobResult handle(JobContext ctx) throws JobHandlerException {
                return body.run(ctx);
            }
        };
    }

    private static ThreadPoolTaskExecutor executor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setThreadNamePrefix("test-handler-");
        e.initialize();
        return e;
    }

    @FunctionalInterface
    private interface Body {
        JobResult run(JobContext ctx) throws JobHandlerException;
    }
}
