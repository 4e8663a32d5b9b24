package io.notify4j;

import io.notify4j.core.DispatchFailure;
import io.notify4j.core.FireEvent;

import java.time.Duration;

/**
 * Observes the worker. Callbacks run on worker threads and must not throw.
 */
public interface DispatchListener {

    default void onPickup(FireEvent event) {
    }

    default void onDelivered(FireEvent event, Duration took) {
    }

    default void onFailure(DispatchFailure failure, Throwable error) {
    }
}
