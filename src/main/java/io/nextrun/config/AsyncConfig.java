package io.nextrun.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for background jobs and for blocking schedule-store calls.
 *
 * <p>The job pool grows with demand: every in-flight job gets its own thread for
 * as long as its reasoning-engine call runs, so a long run never holds up the
 * others. Idle threads are reclaimed after a minute. The store pool is separate
 * and bounded.</p>
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    public static final String JOB_EXECUTOR = "jobExecutor";
    public static final String SCHEDULE_STORE_EXECUTOR = "scheduleStoreExecutor";

    @Bean(name = JOB_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService jobExecutor() {
        log.info("Job executor configured with an unbounded cached pool");
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-job-"));
    }

    @Bean(name = SCHEDULE_STORE_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService scheduleStoreExecutor(@Value("${agent.schedule.store-threads:2}") int threads) {
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("schedule-store-"));
    }
}
