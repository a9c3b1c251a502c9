package org.schedstore.store.api;

/**
 * A message with a payload already exists for the given message id.
 */
public class MessageExistsException extends StoreException {

    public MessageExistsException(String message) {
        super(StoreErrorType.MESSAGE_EXISTS, message);
    }

    public MessageExistsException(String message, Throwable cause) {
        super(StoreErrorType.MESSAGE_EXISTS, message, cause);
    }
}
