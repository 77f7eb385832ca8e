package io.mindprint.core.sync;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class InstallationProbeTest {

    @Test
    void shouldDeriveStableAnonymousIdentifiers() {
        InstallationProbe probe = new InstallationProbe();

        Installation first = probe.probe();
        Installation second = probe.probe();

        assertThat(first.userId()).matches("[0-9a-f]{32}").isEqualTo(second.userId());
        assertThat(first.hostFingerprint()).matches("[0-9a-f]{64}").isEqualTo(second.hostFingerprint());
        assertThat(first.metadata()).containsOnlyKeys("osName", "osVersion", "arch", "javaVersion");
    }

    @Test
    void recordShouldStartWithFirstAndLastSeenEqual() {
        Installation host = new InstallationProbe().probe();
        Instant now = Instant.parse("2026-05-01T08:30:00Z");

        var record = host.recordFor("user-1", now);

        assertThat(record.firstSeen()).isEqualTo(now);
        assertThat(record.lastSeen()).isEqualTo(now);
        assertThat(record.hostFingerprint()).isEqualTo(host.hostFingerprint());
    }
}
