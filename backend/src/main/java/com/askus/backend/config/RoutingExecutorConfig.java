package com.askus.backend.config;

import com.askus.backend.routing.RoutingProperties;
import com.askus.backend.util.BoundedCalls;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared pool for outbound embedding, vector-store and LLM calls. Request
 * threads wait on it with a per-call timeout.
 */
@Configuration
public class RoutingExecutorConfig {

    @Bean(name = "routingCallExecutor")
    public ThreadPoolTaskExecutor routingCallExecutor(RoutingProperties props) {
        RoutingProperties.Executor cfg = props.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("routing-call-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public BoundedCalls boundedCalls(ThreadPoolTaskExecutor routingCallExecutor) {
        return new BoundedCalls(routingCallExecutor);
    }
}
