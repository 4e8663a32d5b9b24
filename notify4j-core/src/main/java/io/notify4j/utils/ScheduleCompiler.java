package io.notify4j.utils;

import io.notify4j.core.DailyTime;
import io.notify4j.core.InvalidScheduleFormatException;
import org.quartz.CronExpression;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compiles {@code HH:mm} schedule strings into {@link DailyTime} recurrences.
 * <p>
 * Only the two-digit:two-digit shape is checked by default, so {@code "99:99"} compiles.
 * Strict mode additionally requires a valid clock time (hour 00-23, minute 00-59).
 */
public final class ScheduleCompiler {

    private static final Pattern SCHEDULE_PATTERN = Pattern.compile("^\\d{2}:\\d{2}$");

    private ScheduleCompiler() {
    }

    /**
     * Permissive compile: shape check only.
     *
     * @throws InvalidScheduleFormatException if {@code schedule} is not {@code HH:mm}
     */
    public static DailyTime compile(String schedule) {
        return compile(schedule, false);
    }

    /**
     * Compile a schedule string.
     *
     * @param schedule    wall-clock time, e.g. "13:30"
     * @param strictRange if true, reject values that are not a valid time of day
     */
    public static DailyTime compile(String schedule, boolean strictRange) {
        if (schedule == null || !SCHEDULE_PATTERN.matcher(schedule).matches()) {
            throw new InvalidScheduleFormatException(schedule);
        }

        int hour = Integer.parseInt(schedule.substring(0, 2));
        int minute = Integer.parseInt(schedule.substring(3, 5));
        DailyTime time = new DailyTime(hour, minute);

        if (strictRange && !CronExpression.isValidExpression(toQuartzCron(time))) {
            throw new InvalidScheduleFormatException(schedule,
                    "schedule is not a valid time of day (00:00-23:59): " + schedule);
        }
        return time;
    }

    /**
     * Computes the soonest instant strictly after {@code now} whose local wall clock in
     * {@code zone} matches {@code recurrence}. Rolls to the next calendar day when today's
     * occurrence is not in the future.
     *
     * <p>Out-of-range values are counted from local midnight, so "24:30" lands on 00:30 of
     * the following day.
     */
    public static Instant nextFireAt(DailyTime recurrence, Instant now, ZoneId zone) {
        Objects.requireNonNull(recurrence, "recurrence must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        ZonedDateTime base = ZonedDateTime.ofInstant(now, zone);
        LocalDate day = base.toLocalDate();

        ZonedDateTime candidate = atDailyTime(day, recurrence, zone);
        if (!candidate.isAfter(base)) {
            candidate = atDailyTime(day.plusDays(1), recurrence, zone);
        }
        return candidate.toInstant();
    }

    // Local arithmetic keeps the wall-clock time stable across DST changes.
    private static ZonedDateTime atDailyTime(LocalDate day, DailyTime time, ZoneId zone) {
        LocalDateTime local = day.atStartOfDay()
                .plusHours(time.hour())
                .plusMinutes(time.minute());
        return local.atZone(zone);
    }

    /**
     * Six-field Quartz cron expression firing daily at {@code time}, e.g. "0 30 13 ? * *".
     */
    public static String toQuartzCron(DailyTime time) {
        Objects.requireNonNull(time, "time must not be null");
        return String.join(" ", "0", String.valueOf(time.minute()), String.valueOf(time.hour()), "?", "*", "*");
    }
}
