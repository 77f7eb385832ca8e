package io.mindprint.core.error;

/**
 * Redaction could not be completed. The whole run is aborted; no partial output is produced.
 */
public final class RedactionException extends MindprintException {

    public RedactionException(String message) {
        super(message);
    }

    public RedactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
