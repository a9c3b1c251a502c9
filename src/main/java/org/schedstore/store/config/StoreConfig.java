package org.schedstore.store.config;

import java.nio.file.Path;

import org.schedstore.store.api.EnvVarException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Typed view of the {@code store} configuration block.
 * <p>
 * Example:
 * <pre>
 * store {
 *   database {
 *     url = "jdbc:h2:./data/scheduler-store;MODE=PostgreSQL"
 *     readUrl = "jdbc:h2:tcp://replica/scheduler-store;MODE=PostgreSQL"   # optional
 *     username = "sa"
 *     password = ""
 *     maxPoolSize = 10
 *     minIdle = 2
 *     connectionTimeoutMs = 30000
 *   }
 *   disk {
 *     enabled = true
 *     dataDirectory = "./data/blobs"
 *     minBlobSize = 1024
 *     blobFileSize = 5G
 *   }
 *   migration {
 *     batchSize = 1000
 *     progressIntervalSeconds = 10
 *   }
 *   pagination.defaultLimit = 5000
 * }
 * </pre>
 *
 * @param databaseUrl JDBC url of the primary (write) endpoint
 * @param databaseReadUrl JDBC url of the read replica; equals {@code databaseUrl} when not configured
 */
public record StoreConfig(
        String databaseUrl,
        String databaseReadUrl,
        String username,
        String password,
        int maxPoolSize,
        int minIdle,
        long connectionTimeoutMs,
        boolean useDisk,
        Path dataDirectory,
        long minBlobSize,
        long blobFileSize,
        int migrationBatchSize,
        int progressIntervalSeconds,
        int defaultPageLimit) {

    public static final String ROOT_PATH = "store";

    public StoreConfig {
        if (migrationBatchSize <= 0) {
            throw new IllegalArgumentException("migration batch size must be positive");
        }
        if (defaultPageLimit <= 0) {
            throw new IllegalArgumentException("default page limit must be positive");
        }
    }

    /**
     * Reads the {@code store} block from the application configuration.
     *
     * @param root the resolved application config
     * @return the typed store configuration
     * @throws EnvVarException if a required value is missing or malformed
     */
    public static StoreConfig fromConfig(Config root) throws EnvVarException {
        try {
            Config store = root.getConfig(ROOT_PATH);
            Config db = store.getConfig("database");
            Config disk = store.getConfig("disk");
            Config migration = store.getConfig("migration");

            String url = db.getString("url");
            String readUrl = db.hasPath("readUrl") && !db.getString("readUrl").isBlank()
                ? db.getString("readUrl")
                : url;

            return new StoreConfig(
                url,
                readUrl,
                db.hasPath("username") ? db.getString("username") : "sa",
                db.hasPath("password") ? db.getString("password") : "",
                db.hasPath("maxPoolSize") ? db.getInt("maxPoolSize") : 10,
                db.hasPath("minIdle") ? db.getInt("minIdle") : 2,
                db.hasPath("connectionTimeoutMs") ? db.getLong("connectionTimeoutMs") : 30_000L,
                disk.getBoolean("enabled"),
                Path.of(disk.getString("dataDirectory")),
                disk.hasPath("minBlobSize") ? disk.getBytes("minBlobSize") : 1024L,
                disk.hasPath("blobFileSize") ? disk.getBytes("blobFileSize") : 5L * 1024 * 1024 * 1024,
                migration.getInt("batchSize"),
                migration.hasPath("progressIntervalSeconds") ? migration.getInt("progressIntervalSeconds") : 10,
                store.hasPath("pagination.defaultLimit") ? store.getInt("pagination.defaultLimit") : 5000
            );
        } catch (ConfigException e) {
            throw new EnvVarException("data store env var error: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new EnvVarException("data store env var error: " + e.getMessage(), e);
        }
    }

    /**
     * @return a copy with the blob tier switched on or off
     */
    public StoreConfig withUseDisk(boolean enabled) {
        return new StoreConfig(databaseUrl, databaseReadUrl, username, password, maxPoolSize, minIdle,
            connectionTimeoutMs, enabled, dataDirectory, minBlobSize, blobFileSize, migrationBatchSize,
            progressIntervalSeconds, defaultPageLimit);
    }
}
