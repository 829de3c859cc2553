package com.eyelevel.invoiceingestion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configures the shared scheduler used for the {@code @Scheduled} loops and for lock renewal of
 * active jobs. Queue workers create their own bounded executors, see
 * {@link com.eyelevel.invoiceingestion.service.queue.QueueWorker}.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * The scheduler is sized so that a slow health check never delays lock renewal.
     *
     * @return A configured TaskScheduler bean.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("ingest-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
