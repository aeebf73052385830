package io.taskmaster.runtime;

import io.taskmaster.scan.DiscoveryStats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-attempt counters. Owned by the executing thread; other components see them only
 * through progress events and the persisted task metrics.
 */
final class TaskMetrics {
    long processed;
    long created;
    long updated;
    long skipped;
    long damaged;
    long vanished;
    long parserFailures;
    long permissionErrors;
    long symlinkLoops;
    long ioErrors;
    long filtered;
    long directoriesVisited;
    boolean rootMissing;
    boolean budgetExhausted;

    void absorb(DiscoveryStats stats, long hashPermissionErrors) {
        permissionErrors = stats.permissionErrors() + hashPermissionErrors;
        symlinkLoops = stats.symlinkLoops();
        ioErrors = stats.ioErrors();
        filtered = stats.filtered();
        directoriesVisited = stats.directoriesVisited();
        rootMissing = stats.rootMissing();
        budgetExhausted = stats.budgetExhausted();
    }

    Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("processed", processed);
        out.put("created", created);
        out.put("updated", updated);
        out.put("skipped_unchanged", skipped);
        out.put("damaged", damaged);
        out.put("vanished", vanished);
        out.put("parser_failures", parserFailures);
        out.put("permission_errors", permissionErrors);
        out.put("symlink_loops", symlinkLoops);
        out.put("io_errors", ioErrors);
        out.put("filtered", filtered);
        out.put("directories_visited", directoriesVisited);
        out.put("root_missing", rootMissing);
        out.put("budget_exhausted", budgetExhausted);
        return out;
    }
}
