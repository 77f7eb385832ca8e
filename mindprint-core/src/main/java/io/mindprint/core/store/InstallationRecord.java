package io.mindprint.core.store;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Seller or buyer telemetry: one row per installation, keyed by its hardware-derived user id.
 */
public record InstallationRecord(
    String userId,
    String hostFingerprint,
    Instant firstSeen,
    Instant lastSeen,
    Map<String, String> metadata
) {
    public InstallationRecord {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        hostFingerprint = hostFingerprint == null ? "" : hostFingerprint;
        Objects.requireNonNull(firstSeen, "firstSeen must not be null");
        Objects.requireNonNull(lastSeen, "lastSeen must not be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static InstallationRecord seenAt(String userId, String hostFingerprint, Instant at, Map<String, String> metadata) {
        return new InstallationRecord(userId, hostFingerprint, at, at, metadata);
    }
}
