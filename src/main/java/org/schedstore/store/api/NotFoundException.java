package org.schedstore.store.api;

/**
 * A point lookup matched no row.
 */
public class NotFoundException extends StoreException {

    public NotFoundException(String message) {
        super(StoreErrorType.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(StoreErrorType.NOT_FOUND, message, cause);
    }
}
