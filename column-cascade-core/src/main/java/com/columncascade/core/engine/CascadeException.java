package com.columncascade.core.engine;

/**
 * Thrown when one artifact cannot be cascaded at all, e.g. the target does not exist.
 *
 * <p>{@link CascadeEngine#cascadeAll()} records it per artifact and continues.
 */
public class CascadeException extends RuntimeException {

    public CascadeException(String message) {
        super(message);
    }

    public CascadeException(String message, Throwable cause) {
        super(message, cause);
    }
}
