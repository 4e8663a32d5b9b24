package io.notify4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.core.ArmedTrigger;
import io.notify4j.core.DailyTime;
import io.notify4j.core.TriggerState;
import io.notify4j.core.TriggerStore;
import io.notify4j.utils.ScheduleCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * MongoDB-backed {@link TriggerStore}. Armed triggers survive restarts.
 *
 * <p>Semantics:
 * <ul>
 *   <li>one document per subject ({@code _id = subjectId}); arm is an upsert that replaces it</li>
 *   <li>cancel and claim both use {@code findAndRemove}, so a document is removed by exactly one
 *       of them even across processes</li>
 * </ul>
 *
 * <p>Payloads are stored in their plain JSON form (object, array or scalar) and read back as
 * maps, lists and scalars.
 */
public class MongoTriggerStore implements TriggerStore {
    private static final Logger log = LoggerFactory.getLogger(MongoTriggerStore.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoTriggerStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String arm(String subjectId, Object payload, DailyTime recurrence) {
        if (isBlank(subjectId)) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        Objects.requireNonNull(recurrence, "recurrence must not be null");

        Instant now = clock.instant();
        String triggerKey = UUID.randomUUID().toString();

        Update u = new Update()
                .set("triggerKey", triggerKey)
                .set("state", TriggerState.SCHEDULED)
                .set("hour", recurrence.hour())
                .set("minute", recurrence.minute())
                .set("nextFireAt", ScheduleCompiler.nextFireAt(recurrence, now, clock.getZone()))
                .set("armedAt", now);

        Object storedPayload = toStoredPayload(payload);
        if (storedPayload != null) {
            u.set("payload", storedPayload);
        } else {
            u.unset("payload");
        }

        Query q = new Query(Criteria.where("_id").is(subjectId));
        var result = mongoTemplate.upsert(q, u, ArmedTriggerDocument.class);
        if (result.getUpsertedId() == null) {
            log.debug("Replaced armed trigger subjectId={} newKey={}", subjectId, triggerKey);
        }
        return triggerKey;
    }

    @Override
    public boolean cancel(String triggerKey) {
        if (isBlank(triggerKey)) {
            return false;
        }

        Query q = new Query(
                Criteria.where("triggerKey").is(triggerKey)
                        .and("state").is(TriggerState.SCHEDULED)
        );
        ArmedTriggerDocument removed = mongoTemplate.findAndRemove(q, ArmedTriggerDocument.class);
        if (removed == null) {
            return false;
        }
        log.debug("Cancelled trigger subjectId={} triggerKey={}", removed.getSubjectId(), triggerKey);
        return true;
    }

    /**
     * Claims due triggers one document at a time, earliest first. Each claim is an atomic
     * {@code findAndRemove}, so concurrent pollers never claim the same trigger twice.
     */
    @Override
    public List<ArmedTrigger> listDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        Query dueQuery = new Query(
                Criteria.where("state").is(TriggerState.SCHEDULED)
                        .and("nextFireAt").ne(null).lte(now)
        );
        dueQuery.with(Sort.by(Sort.Order.asc("nextFireAt")));

        List<ArmedTrigger> claimed = new ArrayList<>();
        while (true) {
            ArmedTriggerDocument doc = mongoTemplate.findAndRemove(dueQuery, ArmedTriggerDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(toTrigger(doc).withState(TriggerState.FIRED));
        }
        return claimed;
    }

    @Override
    public Optional<ArmedTrigger> get(String subjectId) {
        if (isBlank(subjectId)) {
            return Optional.empty();
        }
        ArmedTriggerDocument doc = mongoTemplate.findById(subjectId, ArmedTriggerDocument.class);
        if (doc == null || doc.getState().isTerminal()) {
            return Optional.empty();
        }
        return Optional.of(toTrigger(doc));
    }

    private Object toStoredPayload(Object payload) {
        if (payload == null) {
            return null;
        }
        return objectMapper.convertValue(payload, Object.class);
    }

    /**
     * Converts a persisted {@link ArmedTriggerDocument} back into an {@link ArmedTrigger}.
     * Embedded documents come back as plain maps.
     */
    ArmedTrigger toTrigger(ArmedTriggerDocument doc) {
        return new ArmedTrigger(
                doc.getTriggerKey(),
                doc.getSubjectId(),
                new DailyTime(doc.getHour(), doc.getMinute()),
                doc.getNextFireAt(),
                toStoredPayload(doc.getPayload()),
                doc.getState(),
                doc.getArmedAt()
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
