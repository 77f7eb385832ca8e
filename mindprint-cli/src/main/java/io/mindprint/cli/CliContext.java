package io.mindprint.cli;

import io.mindprint.core.config.ConfigPaths;
import io.mindprint.core.config.ConfigService;
import io.mindprint.core.config.model.DistillConfig;
import io.mindprint.core.config.model.MindprintConfig;
import io.mindprint.core.distill.DistillationService;
import io.mindprint.core.distill.Distiller;
import io.mindprint.core.distill.Generalizer;
import io.mindprint.core.distill.MemorySourceLoader;
import io.mindprint.core.distill.SectionClassifier;
import io.mindprint.core.profile.CognitionWriter;
import io.mindprint.core.redaction.Redactor;
import io.mindprint.core.store.SqlitePersonaStore;
import io.mindprint.core.sync.Installation;
import io.mindprint.core.sync.InstallationProbe;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

public record CliContext(
    ConfigService configService,
    Path configPath,
    StoreFactory storeFactory,
    Supplier<Installation> installation,
    Clock clock
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(
            configService,
            configPath,
            config -> new SqlitePersonaStore(
                ConfigPaths.resolve(config.store().path()),
                Duration.ofMillis(config.store().busyTimeoutMillis())
            ),
            () -> new InstallationProbe().probe(),
            Clock.systemUTC()
        );
    }

    public MindprintConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public DistillationService distillationService(MindprintConfig config) {
        DistillConfig distill = config.distill();
        Distiller distiller = new Distiller(
            new Redactor(),
            new Generalizer(),
            new SectionClassifier(distill.minTokens()),
            distill.maxBulletsPerSection()
        );
        return new DistillationService(new MemorySourceLoader(), distiller, new CognitionWriter(), distill.outputDirName());
    }

    /**
     * Configured user id, or the hardware-derived one when none is configured.
     */
    public String userId(MindprintConfig config, Installation host) {
        return config.userId() == null || config.userId().isBlank() ? host.userId() : config.userId();
    }
}
