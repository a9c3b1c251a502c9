package org.schedstore.store.api.storage;

import java.util.List;
import java.util.concurrent.ConcurrentMap;

import org.schedstore.store.api.DatabaseException;

/**
 * Blob tier: point storage of message payload bytes keyed by {@link MessageKey}.
 * <p>
 * The tier holds a derived copy of the relational payloads and is never authoritative.
 * Implementations must be safe for unbounded concurrent readers and writers.
 */
public interface IBlobStore extends AutoCloseable {

    /**
     * Stores {@code binary} under {@code key}, overwriting any previous value.
     *
     * @throws DatabaseException if the underlying engine rejects the write
     */
    void saveBinary(MessageKey key, byte[] binary) throws DatabaseException;

    /**
     * @return {@code true} if a value is stored under {@code key}; read failures count as absent
     */
    boolean exists(MessageKey key);

    /**
     * Fetches the payloads of all {@code keys} concurrently.
     * <p>
     * Keys that are not stored, or whose read fails, are simply absent from the result.
     * Callers treat absence as a tier miss and fall back to the relational store.
     *
     * @param keys keys to look up
     * @return the payloads found, keyed by the requested key
     */
    ConcurrentMap<MessageKey, byte[]> readBinaries(List<MessageKey> keys);

    @Override
    void close();
}
