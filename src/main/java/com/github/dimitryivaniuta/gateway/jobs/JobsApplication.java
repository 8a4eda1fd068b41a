package com.github.dimitryivaniuta.gateway.jobs;

import com.github.dimitryivaniuta.gateway.jobs.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application entry point for the Durable Jobs API.
 *
 * <p>The same artifact runs as the API ({@code default} profile) or as the polling worker
 * ({@code worker} profile).</p>
 */
@SpringBootApplication
@EnableScheduling
@EnableCaching
@EnableConfigurationProperties(AppProperties.class)
public class JobsApplication {

    /**
     * Bootstraps the Spring Boot application.
     *
     * @param args CLI args
     */
    public static void main(String[] args) {
        SpringApplication.run(JobsApplication.class, args);
    }
}
