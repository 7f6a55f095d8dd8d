package com.congruence.core.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Trigger and background-execution settings, bound from {@code congruence.pipeline.*}.
 */
@Component
@ConfigurationProperties(prefix = "congruence.pipeline")
public class PipelineProperties {

    /** Concurrent background runs. */
    private int poolSize = 2;

    /** Background runs waiting for a worker before triggers are rejected. */
    private int queueCapacity = 10;

    /** Branch used when neither the trigger nor the project names one. */
    private String fallbackBranch = "main";

    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

    public String getFallbackBranch() { return fallbackBranch; }
    public void setFallbackBranch(String fallbackBranch) { this.fallbackBranch = fallbackBranch; }
}
