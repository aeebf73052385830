package io.taskmaster.scan;

public record DiscoveryStats(
        long directoriesVisited,
        long entriesSeen,
        long filesMatched,
        long filtered,
        long skippedSymlinks,
        long permissionErrors,
        long symlinkLoops,
        long ioErrors,
        boolean rootMissing,
        boolean budgetExhausted,
        boolean stopped
) {
}
