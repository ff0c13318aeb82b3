package com.callplatform.guardsvc.infrastructure.store;

/**
 * Raised when the shared counter store cannot complete an operation (timeout, connection
 * failure, open circuit). Engines catch it at their public boundary and apply a safe default.
 */
public class CounterStoreException extends RuntimeException {

    private final String operation;

    public CounterStoreException(String operation, Throwable cause) {
        super("Counter store operation failed: " + operation, cause);
        this.operation = operation;
    }

    public CounterStoreException(String operation, String message) {
        super("Counter store operation failed: " + operation + " (" + message + ")");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
