package com.parallax.core.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Concurrency, attempt budget and decomposition settings for item execution.
 */
@Component
@ConfigurationProperties(prefix = "parallax.execution")
public class ExecutionProperties {

    private int maxParallel = 8;
    private int itemTimeoutSeconds = 600;
    private int maxAttempts = 3;
    private int coordinatorTimeoutSeconds = 300;
    private int maxLevelPasses = 50;
    private Decomposition decomposition = new Decomposition();

    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    public int getItemTimeoutSeconds() { return itemTimeoutSeconds; }
    public void setItemTimeoutSeconds(int itemTimeoutSeconds) { this.itemTimeoutSeconds = itemTimeoutSeconds; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public int getCoordinatorTimeoutSeconds() { return coordinatorTimeoutSeconds; }
    public void setCoordinatorTimeoutSeconds(int coordinatorTimeoutSeconds) { this.coordinatorTimeoutSeconds = coordinatorTimeoutSeconds; }
    public int getMaxLevelPasses() { return maxLevelPasses; }
    public void setMaxLevelPasses(int maxLevelPasses) { this.maxLevelPasses = maxLevelPasses; }
    public Decomposition getDecomposition() { return decomposition; }
    public void setDecomposition(Decomposition decomposition) { this.decomposition = decomposition; }

    public static class Decomposition {
        private boolean enabled = true;
        private int minSubItems = 2;
        private int maxSubItems = 5;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMinSubItems() { return minSubItems; }
        public void setMinSubItems(int minSubItems) { this.minSubItems = minSubItems; }
        public int getMaxSubItems() { return maxSubItems; }
        public void setMaxSubItems(int maxSubItems) { this.maxSubItems = maxSubItems; }
    }
}
