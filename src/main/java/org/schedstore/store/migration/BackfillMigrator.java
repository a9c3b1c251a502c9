package org.schedstore.store.migration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.schedstore.store.HybridDataStore;
import org.schedstore.store.api.DatabaseException;
import org.schedstore.store.api.StoreException;
import org.schedstore.store.api.dto.StoredMessage;
import org.schedstore.store.api.storage.IBlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies payloads from the relational tier into the blob tier.
 * <p>
 * Two modes:
 * <ul>
 *   <li>{@link #tailSync()} walks backwards from the newest row and stops at the first row the
 *       blob tier already holds. Run at startup to repair writes lost since the last run.</li>
 *   <li>{@link #migrateRange(OffsetRange)} backfills an offset window in batches, one concurrent
 *       blob write per row. Any failed write aborts the run; rerunning the same range is safe
 *       because blob writes overwrite.</li>
 * </ul>
 */
public class BackfillMigrator {

    private static final Logger log = LoggerFactory.getLogger(BackfillMigrator.class);

    private final HybridDataStore store;
    private final IBlobStore blobStore;
    private final int batchSize;
    private final Duration progressInterval;

    /**
     * @throws DatabaseException if the store was opened without a blob tier
     */
    public BackfillMigrator(HybridDataStore store, int batchSize, Duration progressInterval)
            throws DatabaseException {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.store = store;
        this.blobStore = store.blobTier()
            .orElseThrow(() -> new DatabaseException("Blob tier is disabled; enable store.disk.enabled (USE_DISK)"));
        this.batchSize = batchSize;
        this.progressInterval = progressInterval;
    }

    /**
     * Syncs the newest rows missing from the blob tier.
     * <p>
     * A row that cannot be fetched is logged and skipped. A failed blob write is propagated.
     */
    public MigrationResult tailSync() throws StoreException {
        long start = System.nanoTime();
        long total = store.getMessageCount();
        long written = 0;
        boolean reachedSynced = false;

        log.info("Tail sync: scanning up to {} messages from the newest", total);
        for (long offset = 0; offset < total; offset++) {
            Optional<StoredMessage> row;
            try {
                row = store.getMessageByOffsetFromEnd(offset);
            } catch (StoreException e) {
                log.warn("Tail sync: failed to fetch message at offset {} from end, skipping: {}", offset, e.getMessage());
                continue;
            }
            if (row.isEmpty()) {
                break;
            }
            StoredMessage message = row.get();
            if (blobStore.exists(message.key())) {
                reachedSynced = true;
                break;
            }
            blobStore.saveBinary(message.key(), message.bundle());
            written++;
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.info("Tail sync: wrote {} messages in {} ms{}", written, elapsed.toMillis(),
            reachedSynced ? " (reached synced row)" : "");
        return new MigrationResult(written, elapsed, reachedSynced);
    }

    /**
     * Backfills rows {@code [from, to)} of the messages table. {@code to} is clamped to the
     * current row count.
     *
     * @throws StoreException on the first fetch or write failure
     */
    public MigrationResult migrateRange(OffsetRange range) throws StoreException {
        long start = System.nanoTime();
        long total = range.rowsWithin(store.getMessageCount());
        long end = range.from() + total;
        AtomicLong processed = new AtomicLong();

        log.info("Migrating {} messages, offsets [{}, {})", total, range.from(), end);
        ExecutorService writers = Executors.newCachedThreadPool(new WriterThreadFactory());
        try (ProgressReporter reporter = new ProgressReporter(processed, total, progressInterval)) {
            reporter.start();
            for (long batchStart = range.from(); batchStart < end; batchStart += batchSize) {
                long batchEnd = Math.min(batchStart + batchSize, end);
                List<StoredMessage> rows = store.getAllMessages(batchStart, batchEnd);
                writeBatch(rows, writers, processed);
            }
        } finally {
            writers.shutdownNow();
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.info("Migration of range {} complete: {} messages in {} ms", range, processed.get(), elapsed.toMillis());
        return new MigrationResult(processed.get(), elapsed, false);
    }

    private void writeBatch(List<StoredMessage> rows, ExecutorService writers, AtomicLong processed)
            throws StoreException {
        List<CompletableFuture<Void>> writes = new ArrayList<>(rows.size());
        for (StoredMessage row : rows) {
            writes.add(CompletableFuture.runAsync(() -> {
                try {
                    blobStore.saveBinary(row.key(), row.bundle());
                } catch (DatabaseException e) {
                    throw new CompletionException(e);
                }
                processed.incrementAndGet();
            }, writers));
        }
        try {
            CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Blob write failed, aborting migration: {}", cause.getMessage());
            if (cause instanceof StoreException storeException) {
                throw storeException;
            }
            throw new DatabaseException("Blob write failed: " + cause.getMessage(), cause);
        }
    }

    private static final class WriterThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "blob-writer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
