package com.shlawgathon.mlstorage.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableScheduling
public class AsyncConfig {

    public static final String DELETION_EXECUTOR = "experimentDeletionExecutor";
    public static final String PURGE_EXECUTOR = "experimentPurgeExecutor";

    /**
     * Runs the individual hard deletes of a bulk deletion in parallel.
     */
    @Bean(name = DELETION_EXECUTOR)
    public ThreadPoolTaskExecutor experimentDeletionExecutor(StorageProperties properties) {
        int parallelism = properties.getDeletion().getParallelism();
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(parallelism);
        ex.setMaxPoolSize(parallelism);
        ex.setThreadNamePrefix("experiment-delete-");
        ex.initialize();
        return ex;
    }

    /**
     * Runs hard deletion of a freshly marked experiment tree in the background.
     * Must stay separate from the deletion pool, a purge blocks on deletion tasks.
     */
    @Bean(name = PURGE_EXECUTOR)
    public ThreadPoolTaskExecutor experimentPurgeExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(1);
        ex.setMaxPoolSize(2);
        ex.setQueueCapacity(100);
        ex.setThreadNamePrefix("experiment-purge-");
        ex.initialize();
        return ex;
    }
}
