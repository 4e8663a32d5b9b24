package io.notify4j.internal;

import io.notify4j.core.ArmedTrigger;
import io.notify4j.core.DailyTime;
import io.notify4j.core.TriggerState;
import io.notify4j.core.TriggerStore;
import io.notify4j.utils.ScheduleCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process {@link TriggerStore}. Armed triggers are lost on restart.
 *
 * <p>All state transitions run under one lock: trigger volume is low and a global lock keeps
 * arm, cancel and claim trivially exclusive.
 */
public class InMemoryTriggerStore implements TriggerStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTriggerStore.class);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, ArmedTrigger> bySubject = new HashMap<>();
    private final Map<String, String> subjectByKey = new HashMap<>();

    public InMemoryTriggerStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String arm(String subjectId, Object payload, DailyTime recurrence) {
        requireSubject(subjectId);
        Objects.requireNonNull(recurrence, "recurrence must not be null");

        Instant now = clock.instant();
        ArmedTrigger trigger = new ArmedTrigger(
                UUID.randomUUID().toString(),
                subjectId,
                recurrence,
                ScheduleCompiler.nextFireAt(recurrence, now, clock.getZone()),
                payload,
                TriggerState.SCHEDULED,
                now
        );

        lock.lock();
        try {
            ArmedTrigger previous = bySubject.put(subjectId, trigger);
            if (previous != null) {
                subjectByKey.remove(previous.triggerKey());
                log.debug("Replaced trigger subjectId={} oldKey={} newKey={}",
                        subjectId, previous.triggerKey(), trigger.triggerKey());
            }
            subjectByKey.put(trigger.triggerKey(), subjectId);
        } finally {
            lock.unlock();
        }
        return trigger.triggerKey();
    }

    @Override
    public boolean cancel(String triggerKey) {
        if (triggerKey == null || triggerKey.isBlank()) {
            return false;
        }

        lock.lock();
        try {
            String subjectId = subjectByKey.remove(triggerKey);
            if (subjectId == null) {
                return false;
            }
            ArmedTrigger removed = bySubject.remove(subjectId);
            log.debug("Cancelled trigger subjectId={} triggerKey={} nextFireAt={}",
                    subjectId, triggerKey, removed.nextFireAt());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ArmedTrigger> listDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        List<ArmedTrigger> claimed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<ArmedTrigger> it = bySubject.values().iterator();
            while (it.hasNext()) {
                ArmedTrigger trigger = it.next();
                if (trigger.isDue(now)) {
                    it.remove();
                    subjectByKey.remove(trigger.triggerKey());
                    claimed.add(trigger.withState(TriggerState.FIRED));
                }
            }
        } finally {
            lock.unlock();
        }

        claimed.sort(Comparator.comparing(ArmedTrigger::nextFireAt));
        return claimed;
    }

    @Override
    public Optional<ArmedTrigger> get(String subjectId) {
        if (subjectId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(bySubject.get(subjectId));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return bySubject.size();
        } finally {
            lock.unlock();
        }
    }

    private static void requireSubject(String subjectId) {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        if (subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
    }
}
