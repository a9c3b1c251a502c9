package org.schedstore.store.api;

/**
 * A pagination cursor or migration offset is not a valid integer.
 */
public class IntParseException extends StoreException {

    public IntParseException(String message) {
        super(StoreErrorType.INT_ERROR, message);
    }

    public IntParseException(String message, Throwable cause) {
        super(StoreErrorType.INT_ERROR, message, cause);
    }
}
