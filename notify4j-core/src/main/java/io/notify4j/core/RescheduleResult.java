package io.notify4j.core;

/**
 * Result of replacing the notification schedule of a note.
 *
 * message  : human-readable confirmation
 * jobId    : key of the newly armed trigger
 * schedule : the HH:mm schedule as requested
 */
public record RescheduleResult(
        String message,
        String jobId,
        String schedule
) {

    public static final String UPDATED_MESSAGE = "Notification schedule updated";

    public static RescheduleResult updated(String jobId, String schedule) {
        return new RescheduleResult(UPDATED_MESSAGE, jobId, schedule);
    }
}
