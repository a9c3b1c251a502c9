package org.schedstore.store.api;

/**
 * Relational engine failures, pool checkout failures and generic failures from other subsystems (the blob tier included).
 */
public class DatabaseException extends StoreException {

    public DatabaseException(String message) {
        super(StoreErrorType.DATABASE_ERROR, message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(StoreErrorType.DATABASE_ERROR, message, cause);
    }
}
