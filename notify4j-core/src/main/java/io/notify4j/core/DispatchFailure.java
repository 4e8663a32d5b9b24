package io.notify4j.core;

import java.time.Instant;

/**
 * A fire event whose dispatch failed. Kept for inspection only; never retried.
 */
public record DispatchFailure(
        FireEvent event,
        Instant failedAt,
        String errorType,
        String message
) {

    public static DispatchFailure of(FireEvent event, Instant failedAt, Throwable error) {
        return new DispatchFailure(event, failedAt, error.getClass().getName(), error.getMessage());
    }
}
