package io.notify4j.config;

import io.notify4j.internal.mongo.ArmedTriggerDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for armed triggers.
 *
 * <p>Indexes are <b>not</b> created automatically unless
 * {@code notify.ensure-indexes-on-startup=true}; production indexes are expected to come from
 * migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code armed_triggers})</h3>
 * <ul>
 *   <li><b>ux_trigger_key</b> (unique): { triggerKey: 1 }
 *       <br/>Used by cancel; a trigger key identifies exactly one armed trigger.</li>
 *   <li><b>idx_due</b>: { state: 1, nextFireAt: 1 }
 *       <br/>Used by the scheduler to claim due triggers earliest first.</li>
 * </ul>
 * One trigger per subject needs no index: the subject id is the document {@code _id}.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.armed_triggers.createIndex({ triggerKey: 1 }, { name: "ux_trigger_key", unique: true });
 * db.armed_triggers.createIndex({ state: 1, nextFireAt: 1 }, { name: "idx_due" });
 * </pre>
 */
public class NotifyMongoIndexConfig {

    public static final String UX_TRIGGER_KEY = "ux_trigger_key";
    public static final String IDX_DUE = "idx_due";

    private final MongoTemplate mongoTemplate;

    public NotifyMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ArmedTriggerDocument.class).ensureIndex(triggerKeyIndex());
        mongoTemplate.indexOps(ArmedTriggerDocument.class).ensureIndex(dueIndex());
    }

    public static Index triggerKeyIndex() {
        return new Index()
                .on("triggerKey", Sort.Direction.ASC)
                .unique()
                .named(UX_TRIGGER_KEY);
    }

    public static Index dueIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("nextFireAt", Sort.Direction.ASC)
                .named(IDX_DUE);
    }
}
