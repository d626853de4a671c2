package com.missionguard.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the engine.
 *
 * <ul>
 *   <li>{@code upstreamExecutor}: KG snapshot and dataset profile fetches.</li>
 *   <li>{@code reportExecutor}: report jobs started in the background.</li>
 *   <li>{@code synthesisExecutor}: section rendering tasks, bounded per report by a semaphore.</li>
 *   <li>{@code gatewayExecutor}: generative gateway calls run under a time limiter.</li>
 *   <li>{@code auditExecutor}: audit record hand-off.</li>
 * </ul>
 *
 * Platform thread pools; the gateway and upstream pools are I/O bound and sized wider.
 */
@Configuration
@Slf4j
public class ExecutorConfiguration {

    private static final int CPUS = Runtime.getRuntime().availableProcessors();

    @Bean(name = "upstreamExecutor")
    public ThreadPoolTaskExecutor upstreamExecutor() {
        log.info("Configuring upstream fetch executor");
        return pool("upstream-", CPUS * 2, CPUS * 8, 500, false);
    }

    @Bean(name = "reportExecutor")
    public ThreadPoolTaskExecutor reportExecutor() {
        return pool("report-", CPUS, CPUS * 2, 100, false);
    }

    @Bean(name = "synthesisExecutor")
    public ThreadPoolTaskExecutor synthesisExecutor(EngineProperties properties) {
        int perReport = properties.getSynthesis().getMaxConcurrentSections();
        log.info("Configuring synthesis executor ({} concurrent sections per report)", perReport);
        return pool("synthesis-", Math.max(CPUS, perReport), Math.max(CPUS, perReport) * 4, 1000, true);
    }

    @Bean(name = "gatewayExecutor")
    public ThreadPoolTaskExecutor gatewayExecutor() {
        log.info("Configuring generative gateway executor");
        return pool("gateway-", CPUS * 2, CPUS * 8, 1000, false);
    }

    @Bean(name = "auditExecutor")
    public ThreadPoolTaskExecutor auditExecutor() {
        // Single writer keeps audit lines in submission order.
        return pool("audit-", 1, 1, 10_000, false);
    }

    private ThreadPoolTaskExecutor pool(String prefix, int core, int max, int queue, boolean callerRuns) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        if (callerRuns) {
            executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        } else {
            executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        }
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
