package com.columncascade.core.store;

import java.io.IOException;

/**
 * Thrown when the workbook store cannot be opened exclusively, read or written.
 *
 * <p>The engine never retries; retrying is the caller's decision.
 */
public class StoreUnavailableException extends IOException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
