package com.smarttest.core.recovery;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Backoff policy for pipeline step retries, bound from {@code smarttest.retry.*}.
 */
@Component
@ConfigurationProperties(prefix = "smarttest.retry")
public class RetryProperties {

    private int maxAttempts = 3;
    private long baseDelayMs = 1000;
    private double backoffMultiplier = 2.0;
    private long maxDelayMs = 30000;

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public long getBaseDelayMs() { return baseDelayMs; }
    public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
}
