package org.schedstore.store.api.dto;

import org.schedstore.store.api.storage.MessageKey;

/**
 * A {@code messages} row reduced to what the backfill needs: its blob key and payload bytes.
 */
public record StoredMessage(MessageKey key, byte[] bundle) {
}
