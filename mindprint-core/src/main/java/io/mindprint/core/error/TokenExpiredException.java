package io.mindprint.core.error;

public final class TokenExpiredException extends RentalException {

    public TokenExpiredException() {
        super("Rental token has expired");
    }

    @Override
    public String publicMessage() {
        return INVALID_TOKEN;
    }
}
