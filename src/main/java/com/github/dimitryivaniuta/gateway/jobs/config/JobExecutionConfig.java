package com.github.dimitryivaniuta.gateway.jobs.config;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors and clock used by the consumer.
 *
 * <p>Two pools: {@code jobWorkerExecutor} runs one task per job (claim, dispatch, resolve) and
 * {@code jobHandlerExecutor} runs the handler itself, so the worker thread can give up on a handler that
 * exceeds {@code app.jobs.handler-timeout} and interrupt it.</p>
 */
@Configuration
public class JobExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Per-job worker pool. A full queue makes the poller thread run the job itself.
     *
     * @param properties app properties
     * @return executor
     */
    @Bean
    public ThreadPoolTaskExecutor jobWorkerExecutor(AppProperties properties) {
        int threads = Math.max(1, properties.getWorker().getThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(32, threads * 8));
        executor.setThreadNamePrefix("job-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * Handler pool. No queue: a handler either starts on its own thread right away or is rejected, never run on
     * the caller's thread where the timeout could not stop it. The extra threads cover push requests and handlers
     * that ignore interruption after a timeout.
     *
     * @param properties app properties
     * @return executor
     */
    @Bean
    public ThreadPoolTaskExecutor jobHandlerExecutor(AppProperties properties) {
        int threads = Math.max(1, properties.getWorker().getThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads * 2);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("job-handler-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        return executor;
    }
}
