package io.notify4j.core;

/**
 * Thrown when a schedule string is not a two-digit:two-digit wall-clock time.
 */
public class InvalidScheduleFormatException extends IllegalArgumentException {

    private final String schedule;

    public InvalidScheduleFormatException(String schedule) {
        this(schedule, "schedule must follow the HH:mm format: " + schedule);
    }

    public InvalidScheduleFormatException(String schedule, String message) {
        super(message);
        this.schedule = schedule;
    }

    public String schedule() {
        return schedule;
    }
}
