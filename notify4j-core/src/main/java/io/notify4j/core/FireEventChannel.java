package io.notify4j.core;

/**
 * Inbound channel of the worker. Implementations must not block on dispatch.
 */
@FunctionalInterface
public interface FireEventChannel {
    void publish(FireEvent event);

    /**
     * Whether {@link #publish} currently takes events. Triggers must not be claimed while this is false.
     */
    default boolean isAccepting() {
        return true;
    }
}
