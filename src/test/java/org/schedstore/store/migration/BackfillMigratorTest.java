package org.schedstore.store.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.schedstore.store.StoreTestSupport.bundleOf;
import static org.schedstore.store.StoreTestSupport.dataItem;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.schedstore.store.HybridDataStore;
import org.schedstore.store.StoreTestSupport;
import org.schedstore.store.api.DatabaseException;
import org.schedstore.store.api.contracts.Message;
import org.schedstore.store.api.dto.StoredMessage;
import org.schedstore.store.api.storage.IBlobStore;
import org.schedstore.store.codec.JsonDocumentDecoder;
import org.schedstore.store.config.StoreConfig;
import org.schedstore.store.resources.database.ConnectionPools;
import org.schedstore.store.resources.database.RelationalMetadataStore;
import org.schedstore.store.resources.storage.RocksDbBlobStore;

/**
 * Range backfill and tail-sync over in-memory H2 and a RocksDB directory.
 * <p>
 * Rows are seeded through an orchestrator without blob tier so the blob tier starts empty.
 */
@Tag("integration")
class BackfillMigratorTest {

    private static final Duration FAST_PROGRESS = Duration.ofMillis(50);

    @TempDir
    Path blobDir;

    private RelationalMetadataStore relational;
    private IBlobStore blobs;
    private HybridDataStore store;
    private HybridDataStore seeder;

    @BeforeEach
    void setUp() throws Exception {
        StoreConfig config = StoreTestSupport.inMemoryConfig(true, blobDir);
        relational = new RelationalMetadataStore(new ConnectionPools(config));
        relational.runMigrations();
        blobs = RocksDbBlobStore.fromConfig(config);
        store = new HybridDataStore(relational, blobs, new JsonDocumentDecoder(), 5000);
        seeder = new HybridDataStore(relational, null, new JsonDocumentDecoder(), 5000);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private void seed(long fromTs, int count) throws Exception {
        for (int i = 0; i < count; i++) {
            long ts = fromTs + i * 10L;
            Message message = dataItem("proc", "m-" + ts, ts);
            seeder.saveMessage(message, bundleOf(message));
        }
    }

    private long blobCount() throws Exception {
        return store.getAllMessages(0, null).stream().filter(m -> blobs.exists(m.key())).count();
    }

    @Test
    void constructor_requiresBlobTier() {
        assertThatThrownBy(() -> new BackfillMigrator(seeder, 10, FAST_PROGRESS))
            .isInstanceOf(DatabaseException.class)
            .hasMessageContaining("Blob tier is disabled");
    }

    @Test
    void migrateRange_copiesWholeTableInBatches() throws Exception {
        seed(100, 23);
        BackfillMigrator migrator = new BackfillMigrator(store, 5, FAST_PROGRESS);

        MigrationResult result = migrator.migrateRange(OffsetRange.parse("0"));

        assertThat(result.rowsWritten()).isEqualTo(23);
        assertThat(blobCount()).isEqualTo(23);
        for (StoredMessage row : store.getAllMessages(0, null)) {
            assertThat(blobs.readBinaries(List.of(row.key())).get(row.key())).isEqualTo(row.bundle());
        }
    }

    @Test
    void migrateRange_copiesOnlyTheRequestedWindow() throws Exception {
        seed(100, 10);
        BackfillMigrator migrator = new BackfillMigrator(store, 2, FAST_PROGRESS);

        MigrationResult result = migrator.migrateRange(OffsetRange.parse("2-5"));

        assertThat(result.rowsWritten()).isEqualTo(3);
        List<StoredMessage> all = store.getAllMessages(0, null);
        assertThat(all).filteredOn(m -> blobs.exists(m.key()))
            .extracting(m -> m.key().timestamp())
            .containsExactly(120L, 130L, 140L);
    }

    @Test
    void migrateRange_clampsEndToRowCountAndIsRepeatable() throws Exception {
        seed(100, 10);
        BackfillMigrator migrator = new BackfillMigrator(store, 4, FAST_PROGRESS);

        assertThat(migrator.migrateRange(OffsetRange.parse("8-100")).rowsWritten()).isEqualTo(2);
        assertThat(migrator.migrateRange(OffsetRange.parse("8-100")).rowsWritten()).isEqualTo(2);
        assertThat(blobCount()).isEqualTo(2);
    }

    @Test
    void migrateRange_abortsOnFailedWrite() throws Exception {
        seed(100, 6);
        IBlobStore failing = mock(IBlobStore.class);
        doThrow(new DatabaseException("Failed to write to RocksDB: simulated"))
            .when(failing).saveBinary(argThat(key -> key.timestamp() == 130L), any());
        HybridDataStore failingStore = new HybridDataStore(relational, failing, new JsonDocumentDecoder(), 5000);
        BackfillMigrator migrator = new BackfillMigrator(failingStore, 3, FAST_PROGRESS);

        assertThatThrownBy(() -> migrator.migrateRange(OffsetRange.parse("0")))
            .isInstanceOf(DatabaseException.class)
            .hasMessageContaining("simulated");
    }

    @Test
    void migrateRange_abortsWhenBatchFetchFails() throws Exception {
        seed(100, 6);
        HybridDataStore failingReads = spy(store);
        doThrow(new DatabaseException("Failed to get connection from pool."))
            .when(failingReads).getAllMessages(anyLong(), any());
        BackfillMigrator migrator = new BackfillMigrator(failingReads, 3, FAST_PROGRESS);

        assertThatThrownBy(() -> migrator.migrateRange(OffsetRange.parse("0")))
            .isInstanceOf(DatabaseException.class)
            .hasMessage("Failed to get connection from pool.");
        assertThat(blobCount()).isZero();
    }

    @Test
    void tailSync_skipsRowThatCannotBeFetched() throws Exception {
        seed(100, 4);
        HybridDataStore failingReads = spy(store);
        doThrow(new DatabaseException("Failed to get connection from pool."))
            .when(failingReads).getMessageByOffsetFromEnd(1L);
        BackfillMigrator migrator = new BackfillMigrator(failingReads, 10, FAST_PROGRESS);

        MigrationResult result = migrator.tailSync();

        assertThat(result.rowsWritten()).isEqualTo(3);
        assertThat(result.stoppedAtSyncedRow()).isFalse();
        assertThat(store.getAllMessages(0, null)).filteredOn(m -> blobs.exists(m.key()))
            .extracting(m -> m.key().timestamp())
            .containsExactly(100L, 110L, 130L);
    }

    @Test
    void tailSync_writesMissingRowsThenStopsAtSyncedRow() throws Exception {
        seed(100, 8);
        BackfillMigrator migrator = new BackfillMigrator(store, 10, FAST_PROGRESS);

        MigrationResult first = migrator.tailSync();
        MigrationResult second = migrator.tailSync();

        assertThat(first.rowsWritten()).isEqualTo(8);
        assertThat(first.stoppedAtSyncedRow()).isFalse();
        assertThat(second.rowsWritten()).isZero();
        assertThat(second.stoppedAtSyncedRow()).isTrue();
        assertThat(blobCount()).isEqualTo(8);
    }

    @Test
    void tailSync_catchesUpOnlyNewRows() throws Exception {
        seed(100, 5);
        BackfillMigrator migrator = new BackfillMigrator(store, 10, FAST_PROGRESS);
        migrator.tailSync();

        seed(1000, 3);
        MigrationResult result = migrator.tailSync();

        assertThat(result.rowsWritten()).isEqualTo(3);
        assertThat(result.stoppedAtSyncedRow()).isTrue();
        assertThat(blobCount()).isEqualTo(8);
    }

    @Test
    void tailSync_onEmptyTableWritesNothing() throws Exception {
        BackfillMigrator migrator = new BackfillMigrator(store, 10, FAST_PROGRESS);

        MigrationResult result = migrator.tailSync();

        assertThat(result.rowsWritten()).isZero();
    }
}
