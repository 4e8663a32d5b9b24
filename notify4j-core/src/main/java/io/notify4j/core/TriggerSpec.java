package io.notify4j.core;

import java.util.Objects;

/**
 * Immutable request to fire once at the next occurrence of a daily time.
 * Replacing a trigger for the same subject creates a new spec; specs are never mutated.
 */
public record TriggerSpec(
        String subjectId,
        DailyTime recurrence,
        int limit
) {

    public static final int SINGLE_FIRE = 1;

    public TriggerSpec {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(recurrence, "recurrence must not be null");
        if (subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        if (limit != SINGLE_FIRE) {
            throw new IllegalArgumentException("only single-fire triggers are supported, got limit=" + limit);
        }
    }

    public static TriggerSpec of(String subjectId, DailyTime recurrence) {
        return new TriggerSpec(subjectId, recurrence, SINGLE_FIRE);
    }
}
