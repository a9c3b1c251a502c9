package org.schedstore.store.api.storage;

import java.util.Objects;

/**
 * Logical identity of a message's payload in the blob tier.
 *
 * @param messageId message id
 * @param assignmentId assignment id, {@code null} for canonical rows
 * @param processId owning process
 * @param timestamp the row's timestamp
 */
public record MessageKey(String messageId, String assignmentId, String processId, long timestamp) {

    public MessageKey {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(processId, "processId");
    }
}
