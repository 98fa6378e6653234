package io.cronhook.core;

/**
 * The backing schedule store or dispatch queue could not be reached or rejected the operation.
 * Never retried internally.
 */
public class StoreUnavailableException extends IllegalStateException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
