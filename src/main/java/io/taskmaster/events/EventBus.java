package io.taskmaster.events;

import io.taskmaster.model.EventView;
import io.taskmaster.model.Page;
import io.taskmaster.storage.EventStore;
import io.taskmaster.storage.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Stages push events onto a bounded queue; a single writer thread persists them in batches.
 * A full queue blocks the emitter, which throttles a stage that outruns the database.
 * Before {@link #start()} (and after {@link #close()}) events are written synchronously.
 */
public final class EventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);
    private static final int BATCH_SIZE = 256;
    private static final long RETRY_PAUSE_MS = 100L;

    private final EventStore store;
    private final BlockingQueue<EventStore.EventRow> queue;
    private final LongSupplier clock;
    private final Object progress = new Object();

    private long emitted;
    private long persisted;
    private volatile boolean running;
    private volatile boolean closing;
    private Thread writer;

    public EventBus(EventStore store, int capacity) {
        this(store, capacity, System::currentTimeMillis);
    }

    public EventBus(EventStore store, int capacity, LongSupplier clock) {
        this.store = store;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        closing = false;
        running = true;
        writer = new Thread(this::drainLoop, "taskmaster-event-writer");
        writer.setDaemon(true);
        writer.start();
    }

    public void emit(EventDraft draft) {
        EventStore.EventRow row = new EventStore.EventRow(
                draft.runId(), draft.taskId(), draft.level(), draft.type(),
                draft.message(), draft.payload(), clock.getAsLong()
        );
        if (!running) {
            store.insertBatch(List.of(row));
            return;
        }
        synchronized (progress) {
            emitted++;
        }
        try {
            queue.put(row);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            synchronized (progress) {
                emitted--;
                progress.notifyAll();
            }
            throw new IllegalStateException("interrupted while emitting " + draft.type(), e);
        }
    }

    /**
     * Blocks until every event emitted before this call is persisted, or the timeout passes.
     * Returns false on timeout.
     */
    public boolean flush(long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
        synchronized (progress) {
            long target = emitted;
            while (persisted < target) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0L || !running) {
                    return persisted >= target;
                }
                try {
                    progress.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    public void flush() {
        if (!flush(30_000L)) {
            log.warn("Event flush timed out, queued={}", queue.size());
        }
    }

    public Page<EventView> listEvents(String runId, EventStore.EventQuery query) {
        flush();
        return store.listEvents(runId, query);
    }

    public int queued() {
        return queue.size();
    }

    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            if (!running) {
                return;
            }
            closing = true;
            t = writer;
        }
        try {
            t.join(TimeUnit.SECONDS.toMillis(30));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        synchronized (this) {
            running = false;
            writer = null;
        }
        synchronized (progress) {
            progress.notifyAll();
        }
    }

    private void drainLoop() {
        List<EventStore.EventRow> batch = new ArrayList<>(BATCH_SIZE);
        while (!closing || !queue.isEmpty() || !batch.isEmpty()) {
            if (batch.isEmpty()) {
                try {
                    EventStore.EventRow first = queue.poll(100, TimeUnit.MILLISECONDS);
                    if (first == null) {
                        continue;
                    }
                    batch.add(first);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    closing = true;
                    continue;
                }
                queue.drainTo(batch, BATCH_SIZE - 1);
            }
            try {
                store.insertBatch(batch);
            } catch (PersistenceException e) {
                if (e.kind() == PersistenceException.Kind.LOCK_TIMEOUT && !closing) {
                    log.warn("Event batch write timed out on a lock, retrying {} events", batch.size(), e);
                    pause();
                    continue;
                }
                writeOneByOne(batch, e);
            } catch (RuntimeException e) {
                writeOneByOne(batch, e);
            }
            markPersisted(batch.size());
            batch.clear();
        }
    }

    /**
     * Salvages a batch that failed as a whole; only rows that fail on their own are dropped.
     */
    private void writeOneByOne(List<EventStore.EventRow> batch, RuntimeException batchFailure) {
        log.warn("Event batch of {} failed, writing rows individually", batch.size(), batchFailure);
        for (EventStore.EventRow row : batch) {
            try {
                store.insertBatch(List.of(row));
            } catch (RuntimeException e) {
                log.error("Dropping event {} of run {}", row.type(), row.runId(), e);
            }
        }
    }

    private void markPersisted(int count) {
        synchronized (progress) {
            persisted += count;
            progress.notifyAll();
        }
    }

    private void pause() {
        try {
            Thread.sleep(RETRY_PAUSE_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closing = true;
        }
    }
}
