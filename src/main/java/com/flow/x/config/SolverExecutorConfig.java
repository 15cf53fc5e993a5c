package com.flow.x.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class SolverExecutorConfig {

    @Bean(name = "maxFlowExecutor")
    public ThreadPoolTaskExecutor maxFlowExecutor(
            @Value("${flow.executor.core-pool-size:2}") int corePoolSize,
            @Value("${flow.executor.max-pool-size:4}") int maxPoolSize,
            @Value("${flow.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(corePoolSize);
        exec.setMaxPoolSize(maxPoolSize);
        exec.setQueueCapacity(queueCapacity);
        exec.setThreadNamePrefix("Max-Flow-");
        exec.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        exec.initialize();
        return exec;
    }
}
