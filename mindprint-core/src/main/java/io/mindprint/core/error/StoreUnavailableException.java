package io.mindprint.core.error;

/**
 * The persona store did not answer within its timeout (busy, locked or unreachable).
 */
public final class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
