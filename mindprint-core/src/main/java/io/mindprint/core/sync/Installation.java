package io.mindprint.core.sync;

import io.mindprint.core.store.InstallationRecord;
import java.time.Instant;
import java.util.Map;

/**
 * What this machine reports about itself: a stable user id, a host fingerprint and coarse platform metadata.
 */
public record Installation(String userId, String hostFingerprint, Map<String, String> metadata) {
    public Installation {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public InstallationRecord recordFor(String userId, Instant seenAt) {
        return InstallationRecord.seenAt(userId, hostFingerprint, seenAt, metadata);
    }
}
