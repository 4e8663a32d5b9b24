package io.notify4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of the scheduling engine.
 * <ul>
 *   <li>pollEvery: period of the due-trigger check</li>
 *   <li>workerConcurrency: number of dispatch threads</li>
 *   <li>maxRetainedFailures: size of the failed-dispatch log; 0 keeps none</li>
 *   <li>strictScheduleRange: reject HH:mm values outside 00:00-23:59</li>
 * </ul>
 */
public record SchedulerOptions(
        Duration pollEvery,
        int workerConcurrency,
        int maxRetainedFailures,
        boolean strictScheduleRange
) {

    public SchedulerOptions {
        Objects.requireNonNull(pollEvery, "pollEvery must not be null");
        if (pollEvery.isZero() || pollEvery.isNegative()) {
            throw new IllegalArgumentException("pollEvery must be a positive duration");
        }
        if (workerConcurrency < 1) {
            throw new IllegalArgumentException("workerConcurrency must be at least 1");
        }
        if (maxRetainedFailures < 0) {
            throw new IllegalArgumentException("maxRetainedFailures must not be negative");
        }
    }

    public static SchedulerOptions defaults() {
        return new SchedulerOptions(Duration.ofSeconds(1), 4, 100, false);
    }
}
