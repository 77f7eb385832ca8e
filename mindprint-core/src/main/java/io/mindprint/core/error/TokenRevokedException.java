package io.mindprint.core.error;

public final class TokenRevokedException extends RentalException {

    public TokenRevokedException() {
        super("Rental token was revoked");
    }

    @Override
    public String publicMessage() {
        return INVALID_TOKEN;
    }
}
