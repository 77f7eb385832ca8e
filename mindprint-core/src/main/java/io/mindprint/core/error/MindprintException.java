package io.mindprint.core.error;

/**
 * Root of every failure MindPrint surfaces to its callers.
 */
public abstract class MindprintException extends Exception {

    protected MindprintException(String message) {
        super(message);
    }

    protected MindprintException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same call later may succeed.
     */
    public boolean retryable() {
        return false;
    }
}
