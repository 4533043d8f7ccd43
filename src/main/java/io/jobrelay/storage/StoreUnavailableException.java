package io.jobrelay.storage;

/**
 * The shared store could not complete an operation. The row touched by the failed operation is
 * left as it was before the call.
 */
public final class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
