package org.schedstore.store.api.dto;

import java.util.Objects;

import org.schedstore.store.api.contracts.Message;
import org.schedstore.store.api.storage.MessageKey;

/**
 * Lightweight projection of a {@code messages} row: every column except the payload bytes and
 * the document body.
 * <p>
 * Paged reads resolve a header against the blob tier and use {@link #describes(Message)} to
 * reject a blob that no longer matches its row.
 */
public record MessageHeader(
        long rowId,
        String processId,
        String messageId,
        String assignmentId,
        int epoch,
        int nonce,
        long timestamp,
        String hashChain) {

    public MessageKey key() {
        return new MessageKey(messageId, assignmentId, processId, timestamp);
    }

    /**
     * @return true if every indexed column of this row equals the corresponding field of
     *         {@code message}
     */
    public boolean describes(Message message) {
        return processId.equals(message.getProcessId())
            && messageId.equals(message.getMessageId())
            && Objects.equals(assignmentId, message.getAssignmentId())
            && epoch == message.getEpoch()
            && nonce == message.getNonce()
            && timestamp == message.getTimestamp()
            && hashChain.equals(message.getHashChain());
    }
}
