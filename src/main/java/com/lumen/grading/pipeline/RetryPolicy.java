package com.lumen.grading.pipeline;

import java.time.Duration;

import com.lumen.grading.config.GradingProperties;

/**
 * Bounded exponential backoff.
 *
 * Pure: the decision depends only on how many failures have happened so far.
 *
 * @param maxAttempts total attempts allowed, the first one included
 * @param baseDelayMs delay after the first failure
 * @param maxDelayMs  upper bound for any delay
 * @param multiplier  growth factor between consecutive delays
 */
public record RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double multiplier) {

    public static RetryPolicy forExtraction(GradingProperties properties) {
        GradingProperties.RetryConfig retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getMultiplier());
    }

    public static RetryPolicy forEvaluation(GradingProperties properties) {
        GradingProperties.RetryConfig retry = properties.getRetry();
        return new RetryPolicy(properties.getEvaluation().getMaxTransientAttempts(),
                retry.getBaseDelayMs(), retry.getMaxDelayMs(), retry.getMultiplier());
    }

    public static RetryPolicy forSync(GradingProperties properties) {
        GradingProperties.SyncConfig sync = properties.getSync();
        return new RetryPolicy(sync.getMaxAttempts(), sync.getBaseDelayMs(), sync.getMaxDelayMs(),
                properties.getRetry().getMultiplier());
    }

    /**
     * Whether another attempt is allowed after {@code failures} failed ones.
     */
    public boolean canRetry(int failures) {
        return failures < maxAttempts;
    }

    /**
     * Delay before the next attempt after {@code failures} failed ones (at least 1).
     */
    public Duration backoff(int failures) {
        if (failures < 1) {
            return Duration.ZERO;
        }
        double delay = baseDelayMs * Math.pow(multiplier, failures - 1);
        return Duration.ofMillis((long) Math.min(delay, (double) maxDelayMs));
    }
}
