package org.schedstore.store.api;

/**
 * A structured document could not be serialized or parsed.
 */
public class JsonException extends StoreException {

    public JsonException(String message) {
        super(StoreErrorType.JSON_ERROR, message);
    }

    public JsonException(String message, Throwable cause) {
        super(StoreErrorType.JSON_ERROR, message, cause);
    }
}
