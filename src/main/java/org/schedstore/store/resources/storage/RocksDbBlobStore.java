package org.schedstore.store.resources.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.schedstore.store.api.DatabaseException;
import org.schedstore.store.api.storage.IBlobStore;
import org.schedstore.store.api.storage.MessageKey;
import org.schedstore.store.config.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blob tier on an embedded RocksDB opened in integrated BlobDB mode.
 * <p>
 * Values at or above {@code minBlobSize} are written to separate blob files instead of the LSM
 * tree, so compaction moves keys and blob references rather than the payload bytes. The low
 * default threshold puts nearly every payload into blob files; {@code blobFileSize} caps the
 * size of one blob file.
 * <p>
 * Keys are {@code message___<process>___<timestamp>___<message>[___<assignment>]}, so the entries
 * of one process sit next to each other in timestamp order. Only point access is performed.
 */
public final class RocksDbBlobStore implements IBlobStore {

    private static final Logger log = LoggerFactory.getLogger(RocksDbBlobStore.class);

    static final String KEY_PREFIX = "message";
    static final String KEY_SEPARATOR = "___";

    private final RocksDB db;
    private final Options options;

    public RocksDbBlobStore(Path baseDir, long minBlobSize, long blobFileSize) throws DatabaseException {
        Objects.requireNonNull(baseDir, "baseDir");
        if (minBlobSize < 0) {
            throw new IllegalArgumentException("minBlobSize must not be negative");
        }
        if (blobFileSize <= 0) {
            throw new IllegalArgumentException("blobFileSize must be positive");
        }
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new DatabaseException("Failed to create blob store directory: " + baseDir, e);
        }
        try {
            RocksDB.loadLibrary();
        } catch (UnsatisfiedLinkError e) {
            throw new DatabaseException("RocksDB native library failed to load on "
                + System.getProperty("os.name") + "/" + System.getProperty("os.arch"), e);
        }
        this.options = new Options()
            .setCreateIfMissing(true)
            .setEnableBlobFiles(true)
            .setMinBlobSize(minBlobSize)
            .setBlobFileSize(blobFileSize);
        try {
            this.db = RocksDB.open(options, baseDir.toString());
        } catch (RocksDBException e) {
            options.close();
            throw new DatabaseException("Failed to open RocksDB at " + baseDir + ": " + e.getMessage(), e);
        }
        log.debug("Blob store opened at {} (minBlobSize={}, blobFileSize={})", baseDir, minBlobSize, blobFileSize);
    }

    public static RocksDbBlobStore fromConfig(StoreConfig config) throws DatabaseException {
        return new RocksDbBlobStore(config.dataDirectory(), config.minBlobSize(), config.blobFileSize());
    }

    @Override
    public void saveBinary(MessageKey key, byte[] binary) throws DatabaseException {
        Objects.requireNonNull(binary, "binary");
        try {
            db.put(encodeKey(key), binary);
        } catch (RocksDBException e) {
            throw new DatabaseException("Failed to write to RocksDB: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(MessageKey key) {
        try {
            return db.get(encodeKey(key)) != null;
        } catch (RocksDBException e) {
            log.debug("Existence check failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public ConcurrentMap<MessageKey, byte[]> readBinaries(List<MessageKey> keys) {
        ConcurrentMap<MessageKey, byte[]> binaries = new ConcurrentHashMap<>();
        keys.parallelStream().forEach(key -> {
            try {
                byte[] value = db.get(encodeKey(key));
                if (value != null) {
                    binaries.put(key, value);
                }
            } catch (RocksDBException e) {
                log.debug("Blob read failed for {}, treating as miss: {}", key, e.getMessage());
            }
        });
        return binaries;
    }

    static byte[] encodeKey(MessageKey key) {
        StringBuilder sb = new StringBuilder(KEY_PREFIX)
            .append(KEY_SEPARATOR).append(key.processId())
            .append(KEY_SEPARATOR).append(key.timestamp())
            .append(KEY_SEPARATOR).append(key.messageId());
        if (key.assignmentId() != null) {
            sb.append(KEY_SEPARATOR).append(key.assignmentId());
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        db.close();
        options.close();
    }
}
