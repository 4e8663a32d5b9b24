package io.notify4j.core;

import java.time.Instant;

/**
 * A trigger held by a {@link TriggerStore}.
 *
 * <p>Stores only ever hold {@link TriggerState#SCHEDULED} triggers. Instances handed out by
 * {@link TriggerStore#listDue(Instant)} carry {@link TriggerState#FIRED} and are no longer in
 * the store.
 */
public record ArmedTrigger(

        // identity
        String triggerKey,
        String subjectId,

        // scheduling
        DailyTime recurrence,
        Instant nextFireAt,

        // payload handed to the dispatcher
        Object payload,

        TriggerState state,
        Instant armedAt
) {

    public ArmedTrigger withState(TriggerState newState) {
        return new ArmedTrigger(triggerKey, subjectId, recurrence, nextFireAt, payload, newState, armedAt);
    }

    public boolean isDue(Instant now) {
        return !state.isTerminal() && !nextFireAt.isAfter(now);
    }
}
