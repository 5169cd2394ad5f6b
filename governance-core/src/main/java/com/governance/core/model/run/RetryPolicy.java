package com.governance.core.model.run;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry behavior of a playbook step.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> retryableErrors,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1]");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        retryableErrors = retryableErrors == null ? Set.of() : Set.copyOf(retryableErrors);
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * Single attempt, the default for steps that declare no retry block.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0, Set.of(), Set.of());
    }

    /**
     * Playbook-style retry: fixed attempts, exponential backoff from one second, no jitter.
     */
    public static RetryPolicy exponential(int maxAttempts, double backoffMultiplier, Duration maxBackoff) {
        return new RetryPolicy(maxAttempts, Duration.ofSeconds(1), maxBackoff,
            backoffMultiplier, 0.0, Set.of(), Set.of());
    }

    /**
     * @param attemptNumber 1-indexed attempt that just failed
     * @return wait before the next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        double baseBackoffMs = initialBackoff.toMillis() * Math.pow(backoffMultiplier, attemptNumber - 1);
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());
        if (jitterFactor == 0.0) {
            return Duration.ofMillis((long) cappedBackoffMs);
        }

        double jitterRange = cappedBackoffMs * jitterFactor;
        double jittered = cappedBackoffMs - jitterRange
            + ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;
        return Duration.ofMillis((long) jittered);
    }

    public boolean shouldRetry(String errorCode) {
        if (nonRetryableErrors.contains(errorCode)) {
            return false;
        }
        return retryableErrors.isEmpty() || retryableErrors.contains(errorCode);
    }

    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(1);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.0;
        private Set<String> retryableErrors = Set.of();
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryableErrors(Set<String> retryableErrors) {
            this.retryableErrors = retryableErrors;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff,
                backoffMultiplier, jitterFactor, retryableErrors, nonRetryableErrors);
        }
    }
}
