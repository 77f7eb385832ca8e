package io.mindprint.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.mindprint.core.profile.CognitionProfile;
import io.mindprint.core.profile.SectionName;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqlitePersonaStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void upsertShouldKeepFirstSeenAndNeverMoveLastSeenBackwards() throws Exception {
        SqlitePersonaStore store = open();

        store.upsertSeller(InstallationRecord.seenAt("seller-1", "fp-a", T0.plusSeconds(60), Map.of("osName", "Linux")));
        store.upsertSeller(InstallationRecord.seenAt("seller-1", "fp-b", T0, Map.of("osName", "Mac OS X")));

        InstallationRecord afterStale = store.findSeller("seller-1").orElseThrow();
        assertThat(afterStale.firstSeen()).isEqualTo(T0.plusSeconds(60));
        assertThat(afterStale.lastSeen()).isEqualTo(T0.plusSeconds(60));
        assertThat(afterStale.hostFingerprint()).isEqualTo("fp-b");
        assertThat(afterStale.metadata()).containsEntry("osName", "Mac OS X");

        store.upsertSeller(InstallationRecord.seenAt("seller-1", "fp-b", T0.plusSeconds(600), Map.of()));

        InstallationRecord refreshed = store.findSeller("seller-1").orElseThrow();
        assertThat(refreshed.firstSeen()).isEqualTo(T0.plusSeconds(60));
        assertThat(refreshed.lastSeen()).isEqualTo(T0.plusSeconds(600));
    }

    @Test
    void sellersAndBuyersShouldBeSeparate() throws Exception {
        SqlitePersonaStore store = open();

        store.upsertBuyer(InstallationRecord.seenAt("user-1", "fp", T0, Map.of()));

        assertThat(store.findBuyer("user-1")).isPresent();
        assertThat(store.findSeller("user-1")).isEmpty();
    }

    @Test
    void saveAssetShouldReplacePreviousAsset() throws Exception {
        SqlitePersonaStore store = open();
        CognitionProfile first = profile("Learns by teaching others");
        CognitionProfile second = profile("Reads source before documentation");

        store.saveAsset("seller-1", "/w/.mindprint/cognition.md", first, T0);
        store.saveAsset("seller-1", "/w/.mindprint/cognition.md", second, T0.plusSeconds(5));
        store.saveAsset("seller-2", "/v/.mindprint/cognition.md", first, T0);

        assertThat(store.getAsset("seller-1")).contains(second);
        assertThat(store.getAsset("seller-2")).contains(first);
        assertThat(store.getAsset("nobody")).isEmpty();
    }

    @Test
    void saveAssetShouldAcceptTheSameContentTwice() throws Exception {
        SqlitePersonaStore store = open();
        CognitionProfile profile = profile("Learns by teaching others");

        store.saveAsset("seller-1", "/w/.mindprint/cognition.md", profile, T0);
        store.saveAsset("seller-1", "/w/.mindprint/cognition.md", profile, T0.plusSeconds(5));

        assertThat(store.getAsset("seller-1")).contains(profile);
    }

    @Test
    void createRentalShouldRequireASellerAsset() throws Exception {
        SqlitePersonaStore store = open();
        Rental rental = new Rental("opaque-1", "seller-1", T0, T0.plusSeconds(3600), null);

        assertThat(store.createRental(rental)).isFalse();
        assertThat(store.loadGrant("opaque-1")).isEmpty();

        store.saveAsset("seller-1", "/w/.mindprint/cognition.md", profile("Learns by teaching others"), T0);

        assertThat(store.createRental(rental)).isTrue();
        assertThat(store.getSellerId("opaque-1")).contains("seller-1");
        RentalGrant grant = store.loadGrant("opaque-1").orElseThrow();
        assertThat(grant.rental()).isEqualTo(rental);
        assertThat(grant.profile()).contains(profile("Learns by teaching others"));
    }

    @Test
    void revokeShouldOnlyTouchLiveRentals() throws Exception {
        SqlitePersonaStore store = open();
        store.saveAsset("seller-1", "/w/.mindprint/cognition.md", profile("Learns by teaching others"), T0);
        store.createRental(new Rental("live", "seller-1", T0, null, null));
        store.createRental(new Rental("short", "seller-1", T0, T0.plusSeconds(10), null));

        assertThat(store.revokeRental("live", T0.plusSeconds(30))).isTrue();
        assertThat(store.revokeRental("live", T0.plusSeconds(40))).isFalse();
        assertThat(store.revokeRental("short", T0.plusSeconds(30))).isFalse();
        assertThat(store.revokeRental("unknown", T0)).isFalse();

        assertThat(store.loadGrant("live").orElseThrow().rental().revokedAt()).isEqualTo(T0.plusSeconds(30));
        assertThat(store.loadGrant("short").orElseThrow().rental().revoked()).isFalse();
    }

    @Test
    void shouldPersistAcrossInstances() throws Exception {
        Path db = tempDir.resolve("data/mindprint.db");
        new SqlitePersonaStore(db, Duration.ofSeconds(1))
            .saveAsset("seller-1", "/w/.mindprint/cognition.md", profile("Learns by teaching others"), T0);

        assertThat(new SqlitePersonaStore(db, Duration.ofSeconds(1)).getAsset("seller-1")).isPresent();
    }

    private SqlitePersonaStore open() throws Exception {
        return new SqlitePersonaStore(tempDir.resolve("mindprint.db"), Duration.ofSeconds(1));
    }

    private static CognitionProfile profile(String bullet) {
        return CognitionProfile.of(Map.of(SectionName.LEARNING_STYLE, List.of(bullet)));
    }
}
