package com.psl.search.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fanOutExecutorService(ExecutionProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getPoolSize()));
    }
}
