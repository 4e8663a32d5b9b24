package io.notify4j.core;

/**
 * Compiled daily wall-clock time a trigger recurs at.
 *
 * <p>Values are kept exactly as parsed from {@code HH:mm}. Range checking (0-23, 0-59) is not
 * enforced here; see {@link #isClockTime()}.
 */
public record DailyTime(int hour, int minute) {

    public DailyTime {
        if (hour < 0 || minute < 0) {
            throw new IllegalArgumentException("hour and minute must not be negative");
        }
    }

    /**
     * Returns true if hour is 0-23 and minute is 0-59.
     */
    public boolean isClockTime() {
        return hour <= 23 && minute <= 59;
    }

    /**
     * Five-field daily cron pattern, e.g. {@code "30 13 * * *"} for 13:30.
     */
    public String toCronExpression() {
        return minute + " " + hour + " * * *";
    }

    @Override
    public String toString() {
        return String.format("%02d:%02d", hour, minute);
    }
}
