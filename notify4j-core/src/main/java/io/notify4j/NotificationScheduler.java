package io.notify4j;

import io.notify4j.core.ArmedTrigger;
import io.notify4j.core.DispatchFailure;
import io.notify4j.core.RescheduleResult;

import java.util.List;
import java.util.Optional;

/**
 * Main notification scheduling API, used by the note service.
 *
 * <p>Each subject (note) has at most one armed trigger. A trigger fires once, at the next
 * occurrence of its daily {@code HH:mm} time, and is then gone.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 *
 * String key = scheduler.arm(note.id(), "13:30", note);   // on note creation
 * scheduler.reschedule(note.id(), "18:00", note);         // PATCH notification-schedule
 * scheduler.cancel(key);                                  // on note deletion
 *
 * scheduler.stop();
 * }</pre>
 */
public interface NotificationScheduler {
    void start();

    void stop();

    /**
     * True while started and the poller is still claiming due triggers. Becomes false if the
     * poller gives up after repeated store failures.
     */
    boolean isRunning();

    /**
     * Arm the trigger of a subject, replacing any trigger already armed for it.
     *
     * @param schedule wall-clock time in {@code HH:mm} form
     * @return the new trigger key
     * @throws io.notify4j.core.InvalidScheduleFormatException if {@code schedule} is malformed
     */
    String arm(String subjectId, String schedule, Object payload);

    String arm(String subjectId, String schedule);

    /**
     * Replace the trigger of a subject and describe the outcome.
     */
    RescheduleResult reschedule(String subjectId, String schedule, Object payload);

    /**
     * Withdraw a trigger.
     *
     * @return false when the trigger has already fired, was cancelled, or never existed
     */
    boolean cancel(String triggerKey);

    Optional<ArmedTrigger> find(String subjectId);

    /**
     * Dispatches that failed since start, oldest first. Failures are never retried.
     */
    List<DispatchFailure> failedDispatches();
}
