package com.rental.settlement.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executors. {@code notificationExecutor} runs deal notifications after commit;
 * {@code gatewayExecutor} runs gateway HTTP calls so the time limiter can abandon them.
 * Both reject instead of queueing without bound.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(
            @Value("${rental.async.notifications.core-pool-size:5}") int corePoolSize,
            @Value("${rental.async.notifications.max-pool-size:10}") int maxPoolSize,
            @Value("${rental.async.notifications.queue-capacity:100}") int queueCapacity) {
        return executor("notify-", corePoolSize, maxPoolSize, queueCapacity);
    }

    @Bean(name = "gatewayExecutor")
    public ThreadPoolTaskExecutor gatewayExecutor(
            @Value("${rental.async.gateway.core-pool-size:8}") int corePoolSize,
            @Value("${rental.async.gateway.max-pool-size:32}") int maxPoolSize,
            @Value("${rental.async.gateway.queue-capacity:50}") int queueCapacity) {
        return executor("gateway-", corePoolSize, maxPoolSize, queueCapacity);
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int core, int max, int queue) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        log.info("Executor {} ready: core={} max={} queue={}", prefix, core, max, queue);
        return executor;
    }
}
