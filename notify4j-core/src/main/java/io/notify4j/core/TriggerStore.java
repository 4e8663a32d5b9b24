package io.notify4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Registry of armed triggers, keyed by subject id.
 *
 * <p>At most one {@link TriggerState#SCHEDULED} trigger exists per subject. Claiming a due
 * trigger ({@link #listDue(Instant)}) and cancelling it are mutually exclusive: whichever
 * completes first wins and the other observes the post-state.
 */
public interface TriggerStore {

    /**
     * Arm (or re-arm) the trigger of a subject. Any trigger already armed for the subject is
     * discarded and its key stops being cancellable.
     *
     * @return the key of the new trigger
     */
    String arm(String subjectId, Object payload, DailyTime recurrence);

    /**
     * Cancel a scheduled trigger.
     *
     * @return false when no scheduled trigger has this key (unknown, fired or already cancelled)
     */
    boolean cancel(String triggerKey);

    /**
     * Claim every scheduled trigger with {@code nextFireAt <= now}. Claimed triggers are removed
     * from the store in the same call and returned in state {@link TriggerState#FIRED},
     * earliest first.
     */
    List<ArmedTrigger> listDue(Instant now);

    /**
     * Read-only lookup of the scheduled trigger of a subject.
     */
    Optional<ArmedTrigger> get(String subjectId);
}
