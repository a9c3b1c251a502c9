package org.schedstore.store.resources.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DDL of the four relational tables.
 * <p>
 * All statements are idempotent ({@code IF NOT EXISTS}) so that {@link #createTables(Connection)}
 * can run on every startup. The SQL is kept to the subset shared by H2 in PostgreSQL mode and
 * PostgreSQL itself.
 */
public final class RelationalSchema {

    private static final Logger log = LoggerFactory.getLogger(RelationalSchema.class);

    static final List<String> TABLES = List.of(
        "CREATE TABLE IF NOT EXISTS processes (" +
        "  id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY," +
        "  process_id VARCHAR(255) NOT NULL UNIQUE," +
        "  process_data TEXT NOT NULL," +
        "  bundle BYTEA NOT NULL" +
        ")",

        "CREATE TABLE IF NOT EXISTS messages (" +
        "  id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY," +
        "  process_id VARCHAR(255) NOT NULL," +
        "  message_id VARCHAR(255) NOT NULL," +
        "  assignment_id VARCHAR(255) NULL," +
        "  message_data TEXT NOT NULL," +
        "  epoch INT NOT NULL," +
        "  nonce INT NOT NULL," +
        "  timestamp BIGINT NOT NULL," +
        "  bundle BYTEA NOT NULL," +
        "  hash_chain TEXT NOT NULL" +
        ")",

        "CREATE TABLE IF NOT EXISTS schedulers (" +
        "  id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY," +
        "  url VARCHAR(1024) NOT NULL UNIQUE," +
        "  process_count INT NOT NULL" +
        ")",

        "CREATE TABLE IF NOT EXISTS process_schedulers (" +
        "  id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY," +
        "  process_id VARCHAR(255) NOT NULL UNIQUE," +
        "  scheduler_id BIGINT NOT NULL" +
        ")"
    );

    // Pagination, point lookups by either id, and latest-by-insertion all hit these.
    static final List<String> INDEXES = List.of(
        "CREATE INDEX IF NOT EXISTS idx_messages_process_timestamp ON messages (process_id, timestamp)",
        "CREATE INDEX IF NOT EXISTS idx_messages_message_id ON messages (message_id)",
        "CREATE INDEX IF NOT EXISTS idx_messages_assignment_id ON messages (assignment_id)",
        "CREATE INDEX IF NOT EXISTS idx_messages_timestamp ON messages (timestamp)"
    );

    private RelationalSchema() {
    }

    /**
     * Creates all tables and indexes that do not exist yet. Does not commit.
     *
     * @param conn connection on the primary
     * @return number of statements executed
     * @throws SQLException if a statement fails for a reason other than a concurrent creation
     */
    public static int createTables(Connection conn) throws SQLException {
        int executed = 0;
        try (Statement stmt = conn.createStatement()) {
            for (String ddl : TABLES) {
                executeDdlIfNotExists(stmt, ddl);
                executed++;
            }
            for (String ddl : INDEXES) {
                executeDdlIfNotExists(stmt, ddl);
                executed++;
            }
        }
        log.debug("Relational schema ensured ({} statements)", executed);
        return executed;
    }

    /**
     * Runs an {@code IF NOT EXISTS} DDL statement, tolerating the race where another
     * connection created the same object between the existence check and the create.
     */
    private static void executeDdlIfNotExists(Statement stmt, String ddl) throws SQLException {
        try {
            stmt.execute(ddl);
        } catch (SQLException e) {
            String msg = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
            if (msg.contains("already exists")) {
                log.debug("Concurrent DDL detected, object already exists: {}", e.getMessage());
                return;
            }
            throw e;
        }
    }
}
