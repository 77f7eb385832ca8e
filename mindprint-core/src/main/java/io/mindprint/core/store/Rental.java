package io.mindprint.core.store;

import java.time.Instant;
import java.util.Objects;

/**
 * A rental row. {@code expiresAt} is {@code null} for non-expiring rentals, {@code revokedAt}
 * is {@code null} until the rental is revoked.
 */
public record Rental(
    String token,
    String sellerUserId,
    Instant createdAt,
    Instant expiresAt,
    Instant revokedAt
) {
    public Rental {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(sellerUserId, "sellerUserId must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public boolean revoked() {
        return revokedAt != null;
    }

    public boolean expiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
