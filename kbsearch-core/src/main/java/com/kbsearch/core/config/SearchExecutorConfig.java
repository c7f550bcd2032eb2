package com.kbsearch.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/** Executor for the concurrent vector and text branches of hybrid search. */
@Configuration
public class SearchExecutorConfig {
    
    @Bean(name = "searchExecutor")
    public Executor searchExecutor(KnowledgeBaseProperties properties) {
        int threads = properties.getSearch().getExecutorThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("kb-search-");
        executor.initialize();
        return executor;
    }
}
