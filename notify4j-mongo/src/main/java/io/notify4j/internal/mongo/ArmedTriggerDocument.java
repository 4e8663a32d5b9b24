package io.notify4j.internal.mongo;

import io.notify4j.core.TriggerState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for armed triggers. One document per subject.
 *
 * <p>{@code payload} holds the plain JSON form of the armed payload: an embedded document,
 * an array or a scalar.
 */
@Document(collection = "armed_triggers")
public class ArmedTriggerDocument {

    @Id
    private String subjectId;

    private String triggerKey;
    private TriggerState state;

    private int hour;
    private int minute;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextFireAt;

    private Instant armedAt;
    private Object payload;

    public ArmedTriggerDocument() {
    }

    public String getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(String subjectId) {
        this.subjectId = subjectId;
    }

    public String getTriggerKey() {
        return triggerKey;
    }

    public void setTriggerKey(String triggerKey) {
        this.triggerKey = triggerKey;
    }

    public TriggerState getState() {
        return state;
    }

    public void setState(TriggerState state) {
        this.state = state;
    }

    public int getHour() {
        return hour;
    }

    public void setHour(int hour) {
        this.hour = hour;
    }

    public int getMinute() {
        return minute;
    }

    public void setMinute(int minute) {
        this.minute = minute;
    }

    public Instant getNextFireAt() {
        return nextFireAt;
    }

    public void setNextFireAt(Instant nextFireAt) {
        this.nextFireAt = nextFireAt;
    }

    public Instant getArmedAt() {
        return armedAt;
    }

    public void setArmedAt(Instant armedAt) {
        this.armedAt = armedAt;
    }

    public Object getPayload() {
        return payload;
    }

    public void setPayload(Object payload) {
        this.payload = payload;
    }
}
