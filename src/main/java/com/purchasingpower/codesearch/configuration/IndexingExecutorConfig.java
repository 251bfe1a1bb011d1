package com.purchasingpower.codesearch.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool used for per-file symbol extraction during indexing.
 *
 * Extraction is independent per file, so it fans out on this pool while the
 * single index writer collects the results in scan order.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CodeSearchProperties.class)
public class IndexingExecutorConfig {

    @Bean(name = "indexingExecutor")
    public ThreadPoolTaskExecutor indexingExecutor(CodeSearchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(properties.getExtractionThreads());
        executor.setMaxPoolSize(properties.getExtractionThreads());

        // Rebuilds are serialized, so the queue only ever holds one scan's files
        executor.setQueueCapacity(Integer.MAX_VALUE);

        executor.setThreadNamePrefix("index-extract-");
        executor.setWaitForTasksToCompleteOnShutdown(false);

        executor.initialize();

        log.info("Indexing executor configured: threads={}", executor.getCorePoolSize());

        return executor;
    }
}
