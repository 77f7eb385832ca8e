package io.mindprint.core.error;

public class StoreException extends MindprintException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
