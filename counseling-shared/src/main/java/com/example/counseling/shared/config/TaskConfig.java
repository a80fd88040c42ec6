package com.example.counseling.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Runs @Async listeners, e.g. the feedback request sent after an appointment completes.
     */
    @Bean
    @Primary
    public AsyncTaskExecutor asyncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("workflow-async-");
        executor.initialize();
        return executor;
    }

    /**
     * Thread pool for @Scheduled methods.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("expiry-sweep-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Socket frames and REST handlers hop onto this pool before touching the database.
     * Sized to the JDBC connection pool so workers never queue for a connection.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler jdbcScheduler(@Value("${counseling.jdbc.parallelism:10}") int parallelism) {
        return Schedulers.newParallel("jdbc-io-", parallelism);
    }
}
