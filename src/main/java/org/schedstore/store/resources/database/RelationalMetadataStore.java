package org.schedstore.store.resources.database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.schedstore.store.api.DatabaseException;
import org.schedstore.store.api.StoreException;
import org.schedstore.store.api.contracts.Message;
import org.schedstore.store.api.contracts.Process;
import org.schedstore.store.api.contracts.ProcessScheduler;
import org.schedstore.store.api.contracts.Scheduler;
import org.schedstore.store.api.dto.MessageHeader;
import org.schedstore.store.api.dto.StoredMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relational tier: the authoritative store for processes, messages, schedulers and
 * process-scheduler bindings.
 * <p>
 * Reads go to the replica pool, writes to the primary. The only read pinned to the primary is
 * {@link #findLatestMessage(String)}. Each method checks out its own connection and releases it
 * on every exit path. {@link SQLException}s are converted to {@link DatabaseException}.
 */
public class RelationalMetadataStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelationalMetadataStore.class);

    /** SQLSTATE for a unique constraint violation (H2 and PostgreSQL). */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String INSERT_PROCESS =
        "INSERT INTO processes (process_id, process_data, bundle) VALUES (?, ?, ?)";
    private static final String INSERT_MESSAGE =
        "INSERT INTO messages (process_id, message_id, assignment_id, message_data, epoch, nonce, timestamp, bundle, hash_chain) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String INSERT_SCHEDULER =
        "INSERT INTO schedulers (url, process_count) VALUES (?, ?)";
    private static final String INSERT_PROCESS_SCHEDULER =
        "INSERT INTO process_schedulers (process_id, scheduler_id) VALUES (?, ?)";

    private final ConnectionPools pools;

    public RelationalMetadataStore(ConnectionPools pools) {
        this.pools = pools;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws SQLException, StoreException;
    }

    private <T> T onReplica(SqlWork<T> work) throws StoreException {
        try (Connection conn = pools.replica()) {
            return work.apply(conn);
        } catch (SQLException e) {
            throw toDatabaseException(e);
        }
    }

    private <T> T onPrimary(SqlWork<T> work) throws StoreException {
        try (Connection conn = pools.primary()) {
            return work.apply(conn);
        } catch (SQLException e) {
            throw toDatabaseException(e);
        }
    }

    /**
     * Runs {@code work} in a transaction on the primary: commit on success, rollback on failure.
     */
    private <T> T inTransaction(SqlWork<T> work) throws StoreException {
        return onPrimary(conn -> {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | StoreException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
                }
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        });
    }

    static DatabaseException toDatabaseException(SQLException e) {
        return new DatabaseException("data store database error: " + e.getMessage(), e);
    }

    private static boolean isUniqueViolation(SQLException e) {
        return UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    /**
     * Inserts a row unless the unique key is taken. A conflicting row is left untouched.
     *
     * @return {@code true} if a row was inserted
     */
    private boolean insertIfAbsent(String sql, SqlBinder binder) throws StoreException {
        return inTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                binder.bind(stmt);
                return stmt.executeUpdate() > 0;
            } catch (SQLException e) {
                if (isUniqueViolation(e)) {
                    conn.rollback();
                    return false;
                }
                throw e;
            }
        });
    }

    @FunctionalInterface
    private interface SqlBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    // ========================================================================
    // Schema
    // ========================================================================

    /**
     * Creates any missing table or index. Safe to call on every startup.
     *
     * @return a short summary for the startup log
     */
    public String runMigrations() throws StoreException {
        int statements = inTransaction(RelationalSchema::createTables);
        return "Migrations applied... " + statements + " statements ensured";
    }

    // ========================================================================
    // Processes
    // ========================================================================

    public boolean insertProcessIfAbsent(Process process, byte[] bundle) throws StoreException {
        boolean inserted = insertIfAbsent(INSERT_PROCESS, stmt -> {
            stmt.setString(1, process.getProcessId());
            stmt.setString(2, process.toDocument().toString());
            stmt.setBytes(3, bundle != null ? bundle : new byte[0]);
        });
        if (!inserted) {
            log.debug("Process {} already stored, insert skipped", process.getProcessId());
        }
        return inserted;
    }

    public Optional<Process> findProcess(String processId) throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT process_data FROM processes WHERE process_id = ?")) {
                stmt.setString(1, processId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(RowMappers.toProcess(rs)) : Optional.empty();
                }
            }
        });
    }

    // ========================================================================
    // Messages
    // ========================================================================

    /**
     * @return number of rows inserted
     */
    public int insertMessage(Message message, byte[] bundle) throws StoreException {
        return inTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_MESSAGE)) {
                RowMappers.bindMessage(stmt, message, bundle);
                return stmt.executeUpdate();
            }
        });
    }

    /**
     * Earliest-timestamp row whose message id or assignment id equals {@code id}.
     */
    public Optional<Message> findEarliestMessage(String id) throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + RowMappers.MESSAGE_COLUMNS + " FROM messages " +
                    "WHERE message_id = ? OR assignment_id = ? " +
                    "ORDER BY timestamp ASC, id ASC LIMIT 1")) {
                stmt.setString(1, id);
                stmt.setString(2, id);
                return firstMessage(stmt);
            }
        });
    }

    /**
     * Earliest-timestamp row with exactly this message id and, if given, this assignment id.
     * Used as the per-row fallback when the blob tier misses.
     */
    public Optional<Message> findEarliestMessage(String messageId, String assignmentId) throws StoreException {
        return onReplica(conn -> {
            String sql = assignmentId != null
                ? "SELECT " + RowMappers.MESSAGE_COLUMNS + " FROM messages " +
                  "WHERE message_id = ? AND assignment_id = ? ORDER BY timestamp ASC, id ASC LIMIT 1"
                : "SELECT " + RowMappers.MESSAGE_COLUMNS + " FROM messages " +
                  "WHERE message_id = ? ORDER BY timestamp ASC, id ASC LIMIT 1";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, messageId);
                if (assignmentId != null) {
                    stmt.setString(2, assignmentId);
                }
                return firstMessage(stmt);
            }
        });
    }

    /**
     * Most recently inserted row of a process. Always reads the primary: callers make
     * sequencing decisions on the result and cannot tolerate replica lag.
     */
    public Optional<Message> findLatestMessage(String processId) throws StoreException {
        return onPrimary(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + RowMappers.MESSAGE_COLUMNS + " FROM messages " +
                    "WHERE process_id = ? ORDER BY id DESC LIMIT 1")) {
                stmt.setString(1, processId);
                return firstMessage(stmt);
            }
        });
    }

    private static Optional<Message> firstMessage(PreparedStatement stmt) throws SQLException, StoreException {
        try (ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toMessage(rs)) : Optional.empty();
        }
    }

    /**
     * Full rows of a process in timestamp order, {@code from < timestamp <= to}.
     *
     * @param from exclusive lower bound or {@code null}
     * @param to inclusive upper bound or {@code null}
     * @param fetchLimit maximum rows returned
     */
    public List<Message> findMessages(String processId, Long from, Long to, long fetchLimit) throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = prepareRange(conn, RowMappers.MESSAGE_COLUMNS, processId, from, to, fetchLimit);
                 ResultSet rs = stmt.executeQuery()) {
                List<Message> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(RowMappers.toMessage(rs));
                }
                return result;
            }
        });
    }

    /**
     * Same window as {@link #findMessages} without the payload and document columns.
     */
    public List<MessageHeader> findMessageHeaders(String processId, Long from, Long to, long fetchLimit)
            throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = prepareRange(conn, RowMappers.MESSAGE_HEADER_COLUMNS, processId, from, to, fetchLimit);
                 ResultSet rs = stmt.executeQuery()) {
                List<MessageHeader> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(RowMappers.toMessageHeader(rs));
                }
                return result;
            }
        });
    }

    private static PreparedStatement prepareRange(Connection conn, String columns, String processId,
                                                  Long from, Long to, long fetchLimit) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ").append(columns)
            .append(" FROM messages WHERE process_id = ?");
        if (from != null) {
            sql.append(" AND timestamp > ?");
        }
        if (to != null) {
            sql.append(" AND timestamp <= ?");
        }
        sql.append(" ORDER BY timestamp ASC, id ASC LIMIT ?");

        PreparedStatement stmt = conn.prepareStatement(sql.toString());
        try {
            int idx = 1;
            stmt.setString(idx++, processId);
            if (from != null) {
                stmt.setLong(idx++, from);
            }
            if (to != null) {
                stmt.setLong(idx++, to);
            }
            stmt.setLong(idx, fetchLimit);
            return stmt;
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    public long countMessages() throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT COUNT(*) FROM messages");
                 ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    /**
     * Window of all messages in timestamp order, as used by the range backfill.
     *
     * @param offset rows to skip
     * @param limit rows to return, or {@code null} for everything after {@code offset}
     */
    public List<StoredMessage> findAllMessages(long offset, Long limit) throws StoreException {
        return onReplica(conn -> {
            String sql = "SELECT " + RowMappers.STORED_MESSAGE_COLUMNS + " FROM messages ORDER BY timestamp ASC, id ASC"
                + (limit != null ? " LIMIT ? OFFSET ?" : " OFFSET ? ROWS");
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                if (limit != null) {
                    stmt.setLong(1, limit);
                    stmt.setLong(2, offset);
                } else {
                    stmt.setLong(1, offset);
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    List<StoredMessage> result = new ArrayList<>();
                    while (rs.next()) {
                        result.add(RowMappers.toStoredMessage(rs));
                    }
                    return result;
                }
            }
        });
    }

    /**
     * The row {@code offset} positions before the newest one (offset 0 is the newest).
     *
     * @return the row, or empty past the oldest row
     */
    public Optional<StoredMessage> findMessageByOffsetFromEnd(long offset) throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + RowMappers.STORED_MESSAGE_COLUMNS + " FROM messages " +
                    "ORDER BY timestamp DESC, id DESC LIMIT 1 OFFSET ?")) {
                stmt.setLong(1, offset);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(RowMappers.toStoredMessage(rs)) : Optional.empty();
                }
            }
        });
    }

    // ========================================================================
    // Schedulers
    // ========================================================================

    public boolean insertSchedulerIfAbsent(Scheduler scheduler) throws StoreException {
        return insertIfAbsent(INSERT_SCHEDULER, stmt -> {
            stmt.setString(1, scheduler.url());
            stmt.setInt(2, scheduler.processCount());
        });
    }

    /**
     * @return number of rows updated
     */
    public int updateScheduler(long rowId, String url, int processCount) throws StoreException {
        return inTransaction(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE schedulers SET process_count = ?, url = ? WHERE id = ?")) {
                stmt.setInt(1, processCount);
                stmt.setString(2, url);
                stmt.setLong(3, rowId);
                return stmt.executeUpdate();
            }
        });
    }

    public Optional<Scheduler> findScheduler(long rowId) throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + RowMappers.SCHEDULER_COLUMNS + " FROM schedulers WHERE id = ?")) {
                stmt.setLong(1, rowId);
                return firstScheduler(stmt);
            }
        });
    }

    public Optional<Scheduler> findSchedulerByUrl(String url) throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + RowMappers.SCHEDULER_COLUMNS + " FROM schedulers WHERE url = ?")) {
                stmt.setString(1, url);
                return firstScheduler(stmt);
            }
        });
    }

    private static Optional<Scheduler> firstScheduler(PreparedStatement stmt) throws SQLException {
        try (ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? Optional.of(RowMappers.toScheduler(rs)) : Optional.empty();
        }
    }

    public List<Scheduler> findAllSchedulers() throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + RowMappers.SCHEDULER_COLUMNS + " FROM schedulers ORDER BY id ASC");
                 ResultSet rs = stmt.executeQuery()) {
                List<Scheduler> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(RowMappers.toScheduler(rs));
                }
                return result;
            }
        });
    }

    // ========================================================================
    // Process schedulers
    // ========================================================================

    public boolean insertProcessSchedulerIfAbsent(ProcessScheduler processScheduler) throws StoreException {
        return insertIfAbsent(INSERT_PROCESS_SCHEDULER, stmt -> {
            stmt.setString(1, processScheduler.processId());
            stmt.setLong(2, processScheduler.schedulerRowId());
        });
    }

    public Optional<ProcessScheduler> findProcessScheduler(String processId) throws StoreException {
        return onReplica(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + RowMappers.PROCESS_SCHEDULER_COLUMNS + " FROM process_schedulers WHERE process_id = ?")) {
                stmt.setString(1, processId);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(RowMappers.toProcessScheduler(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public void close() {
        pools.close();
    }
}
