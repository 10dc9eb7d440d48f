package com.phillippitts.strategist.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the per-action agent worker pool.
 *
 * <p>One pool is created per analysis and released once the session tracks no pending handle.
 * Three workers cover the three concurrent calls of an analysis.
 */
@Component
@ConfigurationProperties(prefix = "strategist.agents.pool")
public class AgentPoolProperties {

    private int size = 3;
    private int queueCapacity = 0;
    private String threadNamePrefix = "agent-pool-";

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }
}
