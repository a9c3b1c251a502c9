package org.schedstore.cli.commands;

import java.time.Duration;
import java.util.concurrent.Callable;

import org.schedstore.cli.CommandLineInterface;
import org.schedstore.store.HybridDataStore;
import org.schedstore.store.api.IntParseException;
import org.schedstore.store.api.StoreException;
import org.schedstore.store.config.StoreConfig;
import org.schedstore.store.migration.BackfillMigrator;
import org.schedstore.store.migration.MigrationResult;
import org.schedstore.store.migration.OffsetRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Copies the payloads of an offset range of the messages table into the blob tier.
 * <p>
 * The blob tier is opened regardless of {@code store.disk.enabled}. Any failed write aborts
 * with exit code 1; the same range can be rerun.
 */
@Command(
    name = "migrate",
    description = "Backfill message payloads of an offset range into the blob tier"
)
public class MigrateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MigrateCommand.class);

    @Parameters(
        index = "0",
        paramLabel = "<range>",
        description = "Offset range: <from> or <from>-<to> (to exclusive, clamped to the row count)"
    )
    private String range;

    @Option(
        names = {"--batch-size"},
        description = "Rows per batch (default: store.migration.batchSize)"
    )
    private Integer batchSize;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        OffsetRange offsets;
        try {
            offsets = OffsetRange.parse(range);
        } catch (IntParseException e) {
            err.println("Error: invalid range '" + range + "': " + e.getMessage());
            return 1;
        }
        if (batchSize != null && batchSize <= 0) {
            err.println("Error: --batch-size must be positive");
            return 1;
        }

        try {
            StoreConfig storeConfig = parent.getStoreConfig();
            int effectiveBatchSize = batchSize != null ? batchSize : storeConfig.migrationBatchSize();
            try (HybridDataStore store = parent.openStore(true)) {
                BackfillMigrator migrator = new BackfillMigrator(store, effectiveBatchSize,
                    Duration.ofSeconds(storeConfig.progressIntervalSeconds()));
                MigrationResult result = migrator.migrateRange(offsets);
                out.printf("Migrated %d messages (range %s) in %d ms%n",
                    result.rowsWritten(), offsets, result.elapsed().toMillis());
                out.flush();
                return 0;
            }
        } catch (StoreException e) {
            log.error("Migration of range {} failed: {}", offsets, e.getMessage());
            err.println("Error: migration failed (" + e.getType() + "): " + e.getMessage());
            return 1;
        }
    }
}
