package io.mindprint.core.error;

public final class SellerNotFoundException extends RentalException {

    public SellerNotFoundException() {
        super("Seller has no saved cognition asset");
    }

    @Override
    public String publicMessage() {
        return "No cognition profile is available for this seller.";
    }
}
