package org.schedstore.store.migration;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs a shared counter at a fixed interval until it reaches the expected total.
 * <p>
 * The reporter only reads the counter; the writers only increment it. Nothing else is shared.
 */
public class ProgressReporter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final AtomicLong counter;
    private final long expectedTotal;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong reports = new AtomicLong();
    private ScheduledFuture<?> task;

    public ProgressReporter(AtomicLong counter, long expectedTotal, Duration interval) {
        this.counter = counter;
        this.expectedTotal = expectedTotal;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "migration-progress");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        long periodMs = Math.max(interval.toMillis(), 1L);
        task = scheduler.scheduleAtFixedRate(this::report, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private void report() {
        long processed = counter.get();
        reports.incrementAndGet();
        log.info("Messages processed update: {} / {}", processed, expectedTotal);
        if (processed >= expectedTotal) {
            scheduler.shutdown();
        }
    }

    /**
     * @return {@code true} once the reporter has stopped, either on its own or via {@link #close()}
     */
    public boolean isFinished() {
        return scheduler.isShutdown();
    }

    /**
     * @return number of progress lines logged so far
     */
    public long reportCount() {
        return reports.get();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
