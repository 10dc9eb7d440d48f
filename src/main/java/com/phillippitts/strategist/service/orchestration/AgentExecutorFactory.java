package com.phillippitts.strategist.service.orchestration;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Creates the bounded worker pool scoped to one analysis.
 *
 * <p>Callers own the returned executor and must shut it down once no handle submitted to it is
 * tracked anymore. Shutdown must not interrupt running calls.
 */
@FunctionalInterface
public interface AgentExecutorFactory {

    ThreadPoolTaskExecutor create();
}
