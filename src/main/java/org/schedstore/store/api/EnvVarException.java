package org.schedstore.store.api;

/**
 * A required configuration value is missing or has the wrong type.
 */
public class EnvVarException extends StoreException {

    public EnvVarException(String message) {
        super(StoreErrorType.ENV_VAR_ERROR, message);
    }

    public EnvVarException(String message, Throwable cause) {
        super(StoreErrorType.ENV_VAR_ERROR, message, cause);
    }
}
