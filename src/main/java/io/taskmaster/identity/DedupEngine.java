package io.taskmaster.identity;

import io.taskmaster.storage.DuplicateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

public final class DedupEngine {
    private static final Logger log = LoggerFactory.getLogger(DedupEngine.class);

    private final DuplicateStore store;
    private final LongSupplier clock;

    public DedupEngine(DuplicateStore store) {
        this(store, System::currentTimeMillis);
    }

    public DedupEngine(DuplicateStore store, LongSupplier clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Regroups every active record by content hash. Call it only after all file upserts of
     * the current run have committed.
     */
    public DuplicateStore.RebuildResult rebuildDuplicateGroups() {
        long started = clock.getAsLong();
        DuplicateStore.RebuildResult result = store.rebuildExact(started);
        log.info("Rebuilt exact duplicate groups: groups={} relationships={} tookMs={}",
                result.groups(), result.relationships(), clock.getAsLong() - started);
        return result;
    }
}
