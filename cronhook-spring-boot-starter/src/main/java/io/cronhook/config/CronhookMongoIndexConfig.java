package io.cronhook.config;

import io.cronhook.internal.mongo.FireEventDocument;
import io.cronhook.internal.mongo.ScheduleEntryDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for cronhook.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code cronhook.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Collection {@code schedule_entries}</h3>
 * <ul>
 *   <li><b>idx_workspace_index</b>: { workspaceId: 1, index: 1 }
 *       <br/>Exact-match workspace lookup, ordered by trigger position.</li>
 *   <li><b>idx_due_claim</b>: { nextRunAt: 1, lockUntil: 1 }
 *       <br/>Used by the ticker to claim due entries.</li>
 * </ul>
 *
 * <h3>Collection {@code fire_events}</h3>
 * <ul>
 *   <li><b>idx_state_runAt</b>: { state: 1, runAt: 1 }
 *       <br/>Used by workers to claim due events, oldest first.</li>
 *   <li><b>idx_finishedAt</b>: { finishedAt: 1 }
 *       <br/>Used by the retention purge.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.schedule_entries.createIndex({ workspaceId: 1, index: 1 }, { name: "idx_workspace_index" });
 * db.schedule_entries.createIndex({ nextRunAt: 1, lockUntil: 1 }, { name: "idx_due_claim" });
 * db.fire_events.createIndex({ state: 1, runAt: 1 }, { name: "idx_state_runAt" });
 * db.fire_events.createIndex({ finishedAt: 1 }, { name: "idx_finishedAt" });
 * </pre>
 */
public class CronhookMongoIndexConfig {

    public static final String IDX_WORKSPACE_INDEX = "idx_workspace_index";
    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String IDX_STATE_RUN_AT = "idx_state_runAt";
    public static final String IDX_FINISHED_AT = "idx_finishedAt";

    private final MongoTemplate mongoTemplate;

    public CronhookMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the indexes listed above. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduleEntryDocument.class).ensureIndex(workspaceIndex());
        mongoTemplate.indexOps(ScheduleEntryDocument.class).ensureIndex(dueClaimIndex());
        mongoTemplate.indexOps(FireEventDocument.class).ensureIndex(stateRunAtIndex());
        mongoTemplate.indexOps(FireEventDocument.class).ensureIndex(finishedAtIndex());
    }

    public static Index workspaceIndex() {
        return new Index()
                .on("workspaceId", Sort.Direction.ASC)
                .on("index", Sort.Direction.ASC)
                .named(IDX_WORKSPACE_INDEX);
    }

    public static Index dueClaimIndex() {
        return new Index()
                .on("nextRunAt", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }

    public static Index stateRunAtIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("runAt", Sort.Direction.ASC)
                .named(IDX_STATE_RUN_AT);
    }

    public static Index finishedAtIndex() {
        return new Index()
                .on("finishedAt", Sort.Direction.ASC)
                .named(IDX_FINISHED_AT);
    }
}
