package io.mindprint.core.error;

public final class TokenNotFoundException extends RentalException {

    public TokenNotFoundException() {
        super("Rental token is unknown");
    }

    @Override
    public String publicMessage() {
        return INVALID_TOKEN;
    }
}
