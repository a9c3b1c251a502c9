package org.schedstore.store.api;

import org.schedstore.store.api.contracts.Message;

/**
 * Rebuilds a {@link Message} from the raw bytes it was stored with.
 * <p>
 * Used on blob-tier reads, where only the payload bytes are fetched and the document body is
 * not read from the relational store.
 */
@FunctionalInterface
public interface IMessageDecoder {

    /**
     * @param bundle payload bytes as stored by {@link IDataStore#saveMessage}
     * @return the decoded message, carrying {@code bundle}
     * @throws JsonException if the bytes cannot be decoded
     */
    Message decode(byte[] bundle) throws JsonException;
}
