package org.schedstore.store.api;

/**
 * Closed set of failure kinds reported by every {@link IDataStore} operation.
 */
public enum StoreErrorType {
    DATABASE_ERROR,
    NOT_FOUND,
    JSON_ERROR,
    ENV_VAR_ERROR,
    INT_ERROR,
    MESSAGE_EXISTS
}
