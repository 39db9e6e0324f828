package com.ryuqq.packsync.core.spi;

/**
 * Thrown when state cannot be read, parsed, or persisted.
 *
 * <p>A missing state file is not an error; implementations start from an empty state.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateStoreException extends RuntimeException {

    /**
     * Creates a new exception.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
