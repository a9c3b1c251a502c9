package org.schedstore.store.resources.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.schedstore.store.api.DatabaseException;
import org.schedstore.store.config.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * The two HikariCP pools of the relational tier: one against the primary (write) endpoint and
 * one against the read replica.
 * <p>
 * When no replica url is configured both pools point at the primary, but they stay separately
 * bounded. HikariCP validates a connection's liveness before handing it out, so a checkout
 * either yields a live connection or fails with {@link DatabaseException}.
 * <p>
 * Implements {@link AutoCloseable}; closing releases both pools.
 */
public class ConnectionPools implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPools.class);

    private final HikariDataSource primary;
    private final HikariDataSource replica;

    public ConnectionPools(StoreConfig config) throws DatabaseException {
        this.primary = createPool("store-primary", config.databaseUrl(), config);
        try {
            this.replica = createPool("store-replica", config.databaseReadUrl(), config);
        } catch (DatabaseException e) {
            primary.close();
            throw e;
        }
    }

    private static HikariDataSource createPool(String poolName, String jdbcUrl, StoreConfig config)
            throws DatabaseException {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        if (jdbcUrl.startsWith("jdbc:h2:")) {
            hikariConfig.setDriverClassName("org.h2.Driver"); // Explicitly set driver for Fat JAR compatibility
        }
        hikariConfig.setMaximumPoolSize(config.maxPoolSize());
        hikariConfig.setMinimumIdle(Math.min(config.minIdle(), config.maxPoolSize()));
        hikariConfig.setConnectionTimeout(config.connectionTimeoutMs());
        hikariConfig.setUsername(config.username());
        hikariConfig.setPassword(config.password());
        hikariConfig.setPoolName(poolName);

        try {
            HikariDataSource dataSource = new HikariDataSource(hikariConfig);
            log.debug("Connection pool '{}' started (max={}, minIdle={})",
                poolName, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
            return dataSource;
        } catch (RuntimeException e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";

            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String errorMsg = String.format(
                    "Failed to initialize connection pool '%s': database file already in use by another process (%s)",
                    poolName, jdbcUrl);
                log.error(errorMsg);
                throw new DatabaseException(errorMsg, e);
            }

            String errorMsg = String.format("Failed to initialize connection pool '%s': %s. Database: %s. Error: %s",
                poolName, cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new DatabaseException(errorMsg, e);
        }
    }

    /**
     * Checks out a connection from the primary pool. The caller must close it.
     *
     * @throws DatabaseException if the pool cannot hand out a live connection
     */
    public Connection primary() throws DatabaseException {
        return checkout(primary);
    }

    /**
     * Checks out a connection from the replica pool. The caller must close it.
     *
     * @throws DatabaseException if the pool cannot hand out a live connection
     */
    public Connection replica() throws DatabaseException {
        return checkout(replica);
    }

    private static Connection checkout(HikariDataSource dataSource) throws DatabaseException {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            log.debug("Checkout from pool '{}' failed: {}", dataSource.getPoolName(), e.getMessage());
            throw new DatabaseException("Failed to get connection from pool.", e);
        }
    }

    /**
     * Closes both pools.
     * <p>
     * For H2 urls a {@code SHUTDOWN} is issued first so the MVStore flushes all pages to disk
     * before the pool releases its connections.
     */
    @Override
    public void close() {
        shutdownH2(primary);
        closePool(primary);
        closePool(replica);
    }

    private static void shutdownH2(HikariDataSource dataSource) {
        if (dataSource == null || dataSource.isClosed() || !dataSource.getJdbcUrl().startsWith("jdbc:h2:")) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
            log.debug("H2 shutdown executed via pool '{}'", dataSource.getPoolName());
        } catch (SQLException e) {
            // 90121 = database is already closed
            if (e.getErrorCode() == 90121) {
                log.debug("H2 database behind pool '{}' already closed", dataSource.getPoolName());
            } else {
                log.warn("H2 shutdown via pool '{}' failed: {}", dataSource.getPoolName(), e.getMessage());
            }
        }
    }

    private static void closePool(HikariDataSource dataSource) {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.debug("Connection pool '{}' closed", dataSource.getPoolName());
        }
    }
}
