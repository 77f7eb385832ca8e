package io.mindprint.core.store;

import io.mindprint.core.error.StoreException;
import io.mindprint.core.profile.CognitionProfile;
import java.time.Instant;
import java.util.Optional;

public interface PersonaStore {

    /**
     * Inserts the seller or refreshes it: {@code firstSeen} is kept from the first insert and
     * {@code lastSeen} never moves backwards.
     */
    void upsertSeller(InstallationRecord seller) throws StoreException;

    void upsertBuyer(InstallationRecord buyer) throws StoreException;

    Optional<InstallationRecord> findSeller(String userId) throws StoreException;

    Optional<InstallationRecord> findBuyer(String userId) throws StoreException;

    /**
     * Replaces every asset row of {@code sellerUserId} with {@code profile} in one transaction.
     */
    void saveAsset(String sellerUserId, String filePath, CognitionProfile profile, Instant scannedAt) throws StoreException;

    Optional<CognitionProfile> getAsset(String sellerUserId) throws StoreException;

    Optional<String> getSellerId(String token) throws StoreException;

    /**
     * Inserts {@code rental} only if its seller has a saved asset.
     *
     * @return {@code false} when the seller has no asset and nothing was inserted
     */
    boolean createRental(Rental rental) throws StoreException;

    Optional<RentalGrant> loadGrant(String token) throws StoreException;

    /**
     * Marks a live rental revoked. Unknown, already revoked or already expired rentals are left untouched.
     *
     * @return {@code true} when this call revoked the rental
     */
    boolean revokeRental(String token, Instant at) throws StoreException;
}
