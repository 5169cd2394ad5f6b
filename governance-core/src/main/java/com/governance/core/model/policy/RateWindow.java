package com.governance.core.model.policy;

import java.time.Duration;

/**
 * Sliding-window rate limit: at most {@code maxRunsPerWindow} allowed executions
 * within any {@code windowSeconds} interval.
 */
public record RateWindow(int maxRunsPerWindow, long windowSeconds) {

    public RateWindow {
        if (maxRunsPerWindow < 1) {
            throw new IllegalArgumentException("maxRunsPerWindow must be >= 1");
        }
        if (windowSeconds < 1) {
            throw new IllegalArgumentException("windowSeconds must be >= 1");
        }
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }

    /**
     * Build a rate window from the two optional policy fields.
     * Both or neither must be supplied.
     *
     * @return the window, or null when neither field is set
     */
    public static RateWindow fromOptional(Integer maxRunsPerWindow, Long windowSeconds) {
        if (maxRunsPerWindow == null && windowSeconds == null) {
            return null;
        }
        if (maxRunsPerWindow == null || windowSeconds == null) {
            throw new IllegalArgumentException(
                "maxRunsPerWindow and windowSeconds must both be defined or both be omitted");
        }
        return new RateWindow(maxRunsPerWindow, windowSeconds);
    }
}
