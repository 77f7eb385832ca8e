package io.mindprint.core.rental;

import io.mindprint.core.config.model.RentalConfig;
import io.mindprint.core.error.RentalException;
import io.mindprint.core.error.SellerNotFoundException;
import io.mindprint.core.error.StoreException;
import io.mindprint.core.error.TokenExpiredException;
import io.mindprint.core.error.TokenNotFoundException;
import io.mindprint.core.error.TokenRevokedException;
import io.mindprint.core.profile.CognitionProfile;
import io.mindprint.core.store.PersonaStore;
import io.mindprint.core.store.Rental;
import io.mindprint.core.store.RentalGrant;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, validates and revokes rental tokens.
 *
 * <p>A rental is Valid until {@code expiresAt} (inclusive) and then Expired, or Revoked once
 * {@link #revoke(String)} reaches it first. Both end states are terminal. Revocation is checked
 * before expiry, so a revoked token always reports as revoked.
 */
public final class RentalService {
    private static final Logger LOG = LoggerFactory.getLogger(RentalService.class);
    private static final int PERSONA_ID_LENGTH = 16;

    private final PersonaStore store;
    private final Clock clock;
    private final RentalConfig config;
    private final SecureRandom random;

    public RentalService(PersonaStore store, Clock clock, RentalConfig config) {
        this(store, clock, config, new SecureRandom());
    }

    public RentalService(PersonaStore store, Clock clock, RentalConfig config, SecureRandom random) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Issues a token with the configured default lifetime.
     */
    public String issue(String sellerUserId) throws RentalException, StoreException {
        Long hours = config.defaultTtlHours();
        return issue(sellerUserId, hours == null ? null : Duration.ofHours(hours));
    }

    /**
     * Issues a token for {@code sellerUserId}.
     *
     * @param ttl lifetime of the rental; {@code null} issues a non-expiring token
     * @throws SellerNotFoundException when the seller has no saved cognition asset
     */
    public String issue(String sellerUserId, Duration ttl) throws RentalException, StoreException {
        if (sellerUserId == null || sellerUserId.isBlank()) {
            throw new IllegalArgumentException("sellerUserId must not be blank");
        }
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        Instant now = now();
        String opaque = RentalToken.newOpaque(random, config.tokenBytes());
        Rental rental = new Rental(opaque, sellerUserId, now, ttl == null ? null : now.plus(ttl), null);
        if (!store.createRental(rental)) {
            throw new SellerNotFoundException();
        }
        String token = RentalToken.format(config.namespace(), opaque);
        LOG.info("Issued rental {} (expires {})", RentalToken.fingerprint(token),
            rental.expiresAt() == null ? "never" : rental.expiresAt());
        return token;
    }

    public CognitionProfile validate(String token) throws RentalException, StoreException {
        return grant(token).profile().orElseThrow(SellerNotFoundException::new);
    }

    public RentedPersona redeem(String token) throws RentalException, StoreException {
        RentalGrant grant = grant(token);
        CognitionProfile profile = grant.profile().orElseThrow(SellerNotFoundException::new);
        return new RentedPersona(personaId(grant.rental().sellerUserId()), profile);
    }

    /**
     * Revokes a live token. Unknown, expired and already revoked tokens are left as they are.
     *
     * @return {@code true} when this call changed the rental
     */
    public boolean revoke(String token) throws StoreException {
        String opaque = RentalToken.opaque(token);
        if (opaque.isEmpty()) {
            return false;
        }
        boolean revoked = store.revokeRental(opaque, now());
        LOG.info("Revoke rental {}: {}", RentalToken.fingerprint(token), revoked ? "revoked" : "no change");
        return revoked;
    }

    public static String personaId(String sellerUserId) {
        return RentalToken.sha256Hex(sellerUserId).substring(0, PERSONA_ID_LENGTH);
    }

    // Rentals are persisted at millisecond precision.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private RentalGrant grant(String token) throws RentalException, StoreException {
        String opaque = RentalToken.opaque(token);
        if (opaque.isEmpty()) {
            throw new TokenNotFoundException();
        }
        Instant now = now();
        Optional<RentalGrant> loaded = store.loadGrant(opaque);
        if (loaded.isEmpty()) {
            LOG.info("Rejected rental {}: unknown", RentalToken.fingerprint(token));
            throw new TokenNotFoundException();
        }
        Rental rental = loaded.get().rental();
        if (rental.revoked()) {
            LOG.info("Rejected rental {}: revoked", RentalToken.fingerprint(token));
            throw new TokenRevokedException();
        }
        if (rental.expiredAt(now)) {
            LOG.info("Rejected rental {}: expired", RentalToken.fingerprint(token));
            throw new TokenExpiredException();
        }
        return loaded.get();
    }
}
