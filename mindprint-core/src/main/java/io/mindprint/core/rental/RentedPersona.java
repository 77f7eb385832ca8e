package io.mindprint.core.rental;

import io.mindprint.core.profile.CognitionProfile;
import java.util.Objects;

/**
 * What a buyer receives for a valid token. {@code personaId} is derived from the seller id and does not reveal it.
 */
public record RentedPersona(String personaId, CognitionProfile profile) {
    public RentedPersona {
        Objects.requireNonNull(personaId, "personaId must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
    }
}
