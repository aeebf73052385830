package io.taskmaster.scan;

import java.nio.file.Path;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Entry point of the discovery stage. Each call starts a fresh walk; resuming across runs is
 * the manifest's job, not the walker's.
 */
public final class DiscoveryStage {
    private final LongSupplier clock;

    public DiscoveryStage() {
        this(System::currentTimeMillis);
    }

    public DiscoveryStage(LongSupplier clock) {
        this.clock = clock;
    }

    public DiscoveryWalk discover(Path root, ScanFilters filters, ScanBudget budget) {
        return discover(root, filters, budget, error -> {
        }, () -> false);
    }

    /**
     * @param errorSink  receives every per-path failure as it happens
     * @param stopSignal polled before each directory entry; true ends the walk early
     */
    public DiscoveryWalk discover(Path root, ScanFilters filters, ScanBudget budget,
                                  Consumer<DiscoveryError> errorSink, BooleanSupplier stopSignal) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        return new DiscoveryWalk(root, filters, budget, errorSink, stopSignal, clock);
    }
}
