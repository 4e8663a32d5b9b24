package io.notify4j.core;

import java.time.Instant;

/**
 * One-time signal handed from the scheduler to the worker when a trigger became due.
 */
public record FireEvent(
        String triggerKey,
        String subjectId,
        Object payload,
        Instant scheduledFor,
        Instant firedAt
) {

    public static FireEvent of(ArmedTrigger trigger, Instant firedAt) {
        return new FireEvent(
                trigger.triggerKey(),
                trigger.subjectId(),
                trigger.payload(),
                trigger.nextFireAt(),
                firedAt
        );
    }
}
