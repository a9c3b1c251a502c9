package org.schedstore.store.resources.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.Connection;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.schedstore.store.StoreTestSupport;
import org.schedstore.store.api.DatabaseException;
import org.schedstore.store.api.contracts.Message;
import org.schedstore.store.api.contracts.Scheduler;
import org.schedstore.store.api.dto.MessageHeader;
import org.schedstore.store.config.StoreConfig;

@Tag("integration")
class RelationalMetadataStoreTest {

    private ConnectionPools pools;
    private RelationalMetadataStore relational;

    @BeforeEach
    void setUp() throws Exception {
        StoreConfig config = StoreTestSupport.inMemoryConfig(false, null);
        pools = new ConnectionPools(config);
        relational = new RelationalMetadataStore(pools);
        relational.runMigrations();
    }

    @AfterEach
    void tearDown() {
        relational.close();
    }

    @Test
    void insertIfAbsent_reportsWhetherRowWasCreated() throws Exception {
        assertThat(relational.insertSchedulerIfAbsent(new Scheduler(null, "https://su", 0))).isTrue();
        assertThat(relational.insertSchedulerIfAbsent(new Scheduler(null, "https://su", 3))).isFalse();

        // The rolled back duplicate leaves the connection usable
        assertThat(relational.findAllSchedulers()).hasSize(1);
    }

    @Test
    void findMessageHeaders_omitsPayloadColumns() throws Exception {
        Message message = StoreTestSupport.dataItem("p", "m-1", 100);
        relational.insertMessage(message, StoreTestSupport.bundleOf(message));

        MessageHeader header = relational.findMessageHeaders("p", null, null, 10).get(0);

        assertThat(header.messageId()).isEqualTo("m-1");
        assertThat(header.timestamp()).isEqualTo(100L);
        assertThat(header.hashChain()).isEqualTo("hc-m-1");
        assertThat(header.key().assignmentId()).isNull();
    }

    @Test
    void findEarliestMessage_exactLookupRespectsAssignment() throws Exception {
        Message data = StoreTestSupport.dataItem("p", "m-1", 200);
        Message assignment = StoreTestSupport.assignment("p", "m-1", "a-1", 100);
        relational.insertMessage(data, StoreTestSupport.bundleOf(data));
        relational.insertMessage(assignment, StoreTestSupport.bundleOf(assignment));

        assertThat(relational.findEarliestMessage("m-1", "a-1")).map(Message::getAssignmentId).contains("a-1");
        assertThat(relational.findEarliestMessage("m-1", null)).map(Message::getTimestamp).contains(100L);
        assertThat(relational.findEarliestMessage("m-2", null)).isEmpty();
    }

    @Test
    void runMigrations_createsAllTables() throws Exception {
        try (Connection conn = pools.primary();
             ResultSet rs = conn.getMetaData().getTables(null, null, "%", new String[] {"TABLE"})) {
            List<String> names = new ArrayList<>();
            while (rs.next()) {
                names.add(rs.getString("TABLE_NAME").toLowerCase());
            }
            assertThat(names).contains("processes", "messages", "schedulers", "process_schedulers");
        }
    }

    @Test
    void closedPoolsFailCheckout() {
        relational.close();

        assertThatThrownBy(() -> pools.replica())
            .isInstanceOf(DatabaseException.class)
            .hasMessage("Failed to get connection from pool.");
        assertThatThrownBy(() -> relational.countMessages()).isInstanceOf(DatabaseException.class);
    }
}
