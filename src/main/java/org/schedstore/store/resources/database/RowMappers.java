package org.schedstore.store.resources.database;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

import org.schedstore.store.api.JsonException;
import org.schedstore.store.api.contracts.Message;
import org.schedstore.store.api.contracts.Process;
import org.schedstore.store.api.contracts.ProcessScheduler;
import org.schedstore.store.api.contracts.Scheduler;
import org.schedstore.store.api.dto.MessageHeader;
import org.schedstore.store.api.dto.StoredMessage;
import org.schedstore.store.api.storage.MessageKey;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Column lists and {@link ResultSet} mapping for the relational tables.
 * <p>
 * The {@code *_COLUMNS} constants are the exact projections the mappers below expect.
 */
final class RowMappers {

    static final String MESSAGE_COLUMNS =
        "id, process_id, message_id, assignment_id, message_data, epoch, nonce, timestamp, bundle, hash_chain";

    /** Everything but {@code message_data} and {@code bundle}. */
    static final String MESSAGE_HEADER_COLUMNS =
        "id, process_id, message_id, assignment_id, epoch, nonce, timestamp, hash_chain";

    static final String STORED_MESSAGE_COLUMNS =
        "message_id, assignment_id, process_id, timestamp, bundle";

    static final String SCHEDULER_COLUMNS = "id, url, process_count";

    static final String PROCESS_SCHEDULER_COLUMNS = "id, process_id, scheduler_id";

    private RowMappers() {
    }

    static Process toProcess(ResultSet rs) throws SQLException, JsonException {
        return Process.fromDocument(parseDocument(rs.getString("process_data")));
    }

    static Message toMessage(ResultSet rs) throws SQLException, JsonException {
        JsonObject document = parseDocument(rs.getString("message_data"));
        return Message.fromDocument(document, rs.getBytes("bundle"));
    }

    static MessageHeader toMessageHeader(ResultSet rs) throws SQLException {
        return new MessageHeader(
            rs.getLong("id"),
            rs.getString("process_id"),
            rs.getString("message_id"),
            rs.getString("assignment_id"),
            rs.getInt("epoch"),
            rs.getInt("nonce"),
            rs.getLong("timestamp"),
            rs.getString("hash_chain")
        );
    }

    static StoredMessage toStoredMessage(ResultSet rs) throws SQLException {
        MessageKey key = new MessageKey(
            rs.getString("message_id"),
            rs.getString("assignment_id"),
            rs.getString("process_id"),
            rs.getLong("timestamp")
        );
        return new StoredMessage(key, rs.getBytes("bundle"));
    }

    static Scheduler toScheduler(ResultSet rs) throws SQLException {
        return new Scheduler(rs.getLong("id"), rs.getString("url"), rs.getInt("process_count"));
    }

    static ProcessScheduler toProcessScheduler(ResultSet rs) throws SQLException {
        return new ProcessScheduler(rs.getLong("id"), rs.getString("process_id"), rs.getLong("scheduler_id"));
    }

    /**
     * Binds the insert parameters of a {@code messages} row in column order
     * {@code process_id, message_id, assignment_id, message_data, epoch, nonce, timestamp, bundle, hash_chain}.
     */
    static void bindMessage(PreparedStatement stmt, Message message, byte[] bundle) throws SQLException {
        stmt.setString(1, message.getProcessId());
        stmt.setString(2, message.getMessageId());
        if (message.getAssignmentId() != null) {
            stmt.setString(3, message.getAssignmentId());
        } else {
            stmt.setNull(3, Types.VARCHAR);
        }
        stmt.setString(4, message.toDocument().toString());
        stmt.setInt(5, message.getEpoch());
        stmt.setInt(6, message.getNonce());
        stmt.setLong(7, message.getTimestamp());
        stmt.setBytes(8, bundle != null ? bundle : new byte[0]);
        stmt.setString(9, message.getHashChain());
    }

    static JsonObject parseDocument(String json) throws JsonException {
        if (json == null) {
            throw new JsonException("data store json error: document column is null");
        }
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new JsonException("data store json error: document is not a JSON object");
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new JsonException("data store json error: " + e.getMessage(), e);
        }
    }
}
