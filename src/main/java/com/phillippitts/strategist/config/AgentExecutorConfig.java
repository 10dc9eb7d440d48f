package com.phillippitts.strategist.config;

import com.phillippitts.strategist.config.properties.AgentPoolProperties;
import com.phillippitts.strategist.service.orchestration.AgentExecutorFactory;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the per-analysis agent worker pools.
 *
 * <p>Unlike a shared application executor, every analysis gets its own small pool so that
 * abandoned calls of one session can never starve another session. Pools are released by the
 * reconciliation loop once the session tracks no pending handle.
 */
@Configuration
public class AgentExecutorConfig {

    private final AgentPoolProperties poolProperties;

    public AgentExecutorConfig(AgentPoolProperties poolProperties) {
        this.poolProperties = poolProperties;
    }

    /**
     * Factory for agent pools.
     *
     * <p>Pool sizing configured via {@code strategist.agents.pool.*}:
     * <ul>
     *   <li>Core and max pool: default 3, one worker per concurrent call of an analysis</li>
     *   <li>Queue: default 0 (direct hand-off)</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}, so an oversubscribed pool
     * degrades to running the call on the request thread instead of dropping it.
     *
     * <p>Shutdown never interrupts: {@code waitForTasksToCompleteOnShutdown} is set so that
     * {@link ThreadPoolTaskExecutor#shutdown()} only stops accepting work, and the await period
     * is zero so shutdown never blocks the request thread.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (requestId, sessionId) from the
     * submitting thread to the worker thread.
     *
     * @return factory producing initialized executors
     */
    @Bean
    public AgentExecutorFactory agentExecutorFactory() {
        return () -> {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(poolProperties.getSize());
            executor.setMaxPoolSize(poolProperties.getSize());
            executor.setQueueCapacity(poolProperties.getQueueCapacity());
            executor.setThreadNamePrefix(poolProperties.getThreadNamePrefix());
            executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
            executor.setWaitForTasksToCompleteOnShutdown(true);
            executor.setAwaitTerminationSeconds(0);
            executor.setTaskDecorator(threadContextPropagation());
            executor.initialize();
            return executor;
        };
    }

    static TaskDecorator threadContextPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
