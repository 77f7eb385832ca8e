package io.mindprint.core.distill;

import io.mindprint.core.error.RedactionException;
import io.mindprint.core.error.SourceNotFoundException;
import io.mindprint.core.error.WriteException;
import io.mindprint.core.profile.CognitionWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DistillationService {
    private static final Logger LOG = LoggerFactory.getLogger(DistillationService.class);

    private final MemorySourceLoader loader;
    private final Distiller distiller;
    private final CognitionWriter writer;
    private final String outputDirName;

    public DistillationService(MemorySourceLoader loader, Distiller distiller, CognitionWriter writer, String outputDirName) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.distiller = Objects.requireNonNull(distiller, "distiller must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.outputDirName = Objects.requireNonNull(outputDirName, "outputDirName must not be null");
    }

    /**
     * Distills {@code MEMORY.md}/{@code HISTORY.md} found in {@code path} into a cognition document.
     * Nothing is written unless the sources exist and redaction succeeds.
     *
     * @param outputDir target directory, or {@code null} for {@code <path>/<outputDirName>}
     */
    public DistillationReport distill(Path path, Path outputDir)
        throws SourceNotFoundException, RedactionException, WriteException, IOException {
        Path base = path.toAbsolutePath().normalize();
        List<MemorySource> sources = loader.load(base);
        Distillation distillation = distiller.run(sources);
        Path target = outputDir == null ? defaultOutputDir(base) : outputDir.toAbsolutePath().normalize();
        Path document = writer.write(distillation.profile(), target);
        LOG.info("Cognition distilled to {} ({} bullets)", document, distillation.profile().bulletCount());
        return new DistillationReport(
            document,
            distillation.redactions(),
            distillation.profile().bulletCount(),
            distillation.droppedLines()
        );
    }

    public Path defaultOutputDir(Path path) {
        return path.resolve(outputDirName);
    }

    public MemorySourceLoader loader() {
        return loader;
    }
}
