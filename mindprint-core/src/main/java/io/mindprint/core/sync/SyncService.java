package io.mindprint.core.sync;

import io.mindprint.core.distill.DistillationReport;
import io.mindprint.core.distill.DistillationService;
import io.mindprint.core.error.MindprintException;
import io.mindprint.core.error.SourceNotFoundException;
import io.mindprint.core.error.StoreException;
import io.mindprint.core.profile.CognitionDocument;
import io.mindprint.core.profile.CognitionProfile;
import io.mindprint.core.profile.CognitionWriter;
import io.mindprint.core.store.PersonaStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes a workspace's cognition profile as the seller's asset.
 */
public final class SyncService {
    private static final Logger LOG = LoggerFactory.getLogger(SyncService.class);

    private final PersonaStore store;
    private final DistillationService distillation;
    private final WorkspaceLock lock;
    private final Installation installation;
    private final Clock clock;

    public SyncService(
        PersonaStore store,
        DistillationService distillation,
        WorkspaceLock lock,
        Installation installation,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.distillation = Objects.requireNonNull(distillation, "distillation must not be null");
        this.lock = Objects.requireNonNull(lock, "lock must not be null");
        this.installation = Objects.requireNonNull(installation, "installation must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Records seller telemetry, refreshes the cognition document when memory sources exist and saves it
     * as the seller's asset. Without memory sources the existing document is used as is.
     *
     * @throws SourceNotFoundException when neither memory sources nor a cognition document exist
     */
    public SyncReport sync(Path workspace, String sellerUserId) throws MindprintException, IOException {
        if (sellerUserId == null || sellerUserId.isBlank()) {
            throw new IllegalArgumentException("sellerUserId must not be blank");
        }
        Path base = workspace.toAbsolutePath().normalize();
        try (WorkspaceLock.Lease ignored = lock.acquire(base)) {
            Instant now = clock.instant();
            store.upsertSeller(installation.recordFor(sellerUserId, now));

            Path document;
            boolean redistilled = distillation.loader().hasSources(base);
            if (redistilled) {
                DistillationReport report = distillation.distill(base, null);
                document = report.document();
            } else {
                document = distillation.defaultOutputDir(base).resolve(CognitionWriter.FILE_NAME);
                if (!Files.isRegularFile(document)) {
                    throw new SourceNotFoundException(base);
                }
            }

            CognitionProfile profile = readDocument(document);
            store.saveAsset(sellerUserId, relativePath(base, document), profile, now);
            LOG.info("Synced cognition asset ({} bullets, redistilled={})", profile.bulletCount(), redistilled);
            return new SyncReport(sellerUserId, document, profile.bulletCount(), redistilled);
        }
    }

    // Local directory layout stays on this machine; only the workspace-relative path is shared.
    private static String relativePath(Path base, Path document) {
        Path absolute = document.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(base) ? base.relativize(absolute) : absolute.getFileName();
        return relative.toString().replace('\\', '/');
    }

    private CognitionProfile readDocument(Path document) throws IOException, StoreException {
        try {
            return CognitionDocument.parse(Files.readString(document, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new StoreException("Cognition document " + document + " is not valid and was not synced", e);
        }
    }
}
