package io.datascope;

/**
 * Unchecked exception wrapping driver errors raised while acquiring connections
 * or executing statements.
 */
public class DataAccessException extends RuntimeException {
    public DataAccessException(String message) {
        super(message);
    }

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
