package org.schedstore.store.migration;

import java.time.Duration;

/**
 * Outcome of a backfill run.
 *
 * @param rowsWritten blob writes performed
 * @param elapsed wall-clock duration of the run
 * @param stoppedAtSyncedRow tail-sync only: the scan stopped at a row already in the blob tier
 */
public record MigrationResult(long rowsWritten, Duration elapsed, boolean stoppedAtSyncedRow) {
}
