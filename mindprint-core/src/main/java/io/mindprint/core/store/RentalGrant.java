package io.mindprint.core.store;

import io.mindprint.core.profile.CognitionProfile;
import java.util.Objects;
import java.util.Optional;

/**
 * A rental and the seller's current profile, read together in one transaction.
 */
public record RentalGrant(Rental rental, CognitionProfile asset) {
    public RentalGrant {
        Objects.requireNonNull(rental, "rental must not be null");
    }

    public Optional<CognitionProfile> profile() {
        return Optional.ofNullable(asset);
    }
}
