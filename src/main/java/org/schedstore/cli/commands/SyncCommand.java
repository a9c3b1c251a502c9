package org.schedstore.cli.commands;

import java.time.Duration;
import java.util.concurrent.Callable;

import org.schedstore.cli.CommandLineInterface;
import org.schedstore.store.HybridDataStore;
import org.schedstore.store.api.StoreException;
import org.schedstore.store.config.StoreConfig;
import org.schedstore.store.migration.BackfillMigrator;
import org.schedstore.store.migration.MigrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Writes the newest messages missing from the blob tier, stopping at the first synced one.
 */
@Command(
    name = "sync",
    description = "Tail-sync: copy the newest payloads missing from the blob tier"
)
public class SyncCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SyncCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            StoreConfig storeConfig = parent.getStoreConfig();
            try (HybridDataStore store = parent.openStore(true)) {
                BackfillMigrator migrator = new BackfillMigrator(store, storeConfig.migrationBatchSize(),
                    Duration.ofSeconds(storeConfig.progressIntervalSeconds()));
                MigrationResult result = migrator.tailSync();
                out.printf("Synced %d messages in %d ms%n", result.rowsWritten(), result.elapsed().toMillis());
                out.flush();
                return 0;
            }
        } catch (StoreException e) {
            log.error("Tail sync failed: {}", e.getMessage());
            err.println("Error: sync failed (" + e.getType() + "): " + e.getMessage());
            return 1;
        }
    }
}
