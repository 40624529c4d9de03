package com.lumen.grading.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.lumen.grading.config.GradingProperties;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, 1000, 5000, 2.0);

    @Test
    void allowsRetriesUntilTheBound() {
        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
    }

    @Test
    void backoffGrowsExponentiallyAndIsCapped() {
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofMillis(4000));
        assertThat(policy.backoff(4)).isEqualTo(Duration.ofMillis(5000));
        assertThat(policy.backoff(10)).isEqualTo(Duration.ofMillis(5000));
    }

    @Test
    void noDelayBeforeAnyFailure() {
        assertThat(policy.backoff(0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void evaluationPolicyUsesTransientAttemptBound() {
        GradingProperties properties = new GradingProperties();
        properties.getEvaluation().setMaxTransientAttempts(5);
        properties.getRetry().setMaxAttempts(2);

        assertThat(RetryPolicy.forEvaluation(properties).maxAttempts()).isEqualTo(5);
        assertThat(RetryPolicy.forExtraction(properties).maxAttempts()).isEqualTo(2);
    }
}
