package org.schedstore.store.api;

/**
 * Base class of the store's closed exception taxonomy.
 * <p>
 * Native failures (JDBC, RocksDB, Gson, Typesafe Config, number parsing) are converted into one
 * of the subclasses at the store boundary. Most native detail is intentionally folded into the
 * message so callers only ever see {@link #getType()} and a readable text.
 */
public abstract class StoreException extends Exception {

    private final StoreErrorType type;

    protected StoreException(StoreErrorType type, String message) {
        super(message);
        this.type = type;
    }

    protected StoreException(StoreErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    /**
     * @return the taxonomy entry this failure belongs to
     */
    public StoreErrorType getType() {
        return type;
    }
}
