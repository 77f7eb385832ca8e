package io.mindprint.core.error;

/**
 * Typed rental failure. {@link #getMessage()} is for logs; {@link #publicMessage()} is what a
 * buyer or seller is shown and never carries internal identifiers.
 */
public abstract class RentalException extends MindprintException {
    static final String INVALID_TOKEN = "Rental token is not valid.";

    protected RentalException(String message) {
        super(message);
    }

    public abstract String publicMessage();
}
