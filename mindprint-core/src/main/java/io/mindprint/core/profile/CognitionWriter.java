package io.mindprint.core.profile;

import io.mindprint.core.error.WriteException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CognitionWriter {
    public static final String FILE_NAME = "cognition.md";

    private static final Logger LOG = LoggerFactory.getLogger(CognitionWriter.class);

    /**
     * Writes {@code profile} to {@code destinationDir/cognition.md}, creating the directory when needed.
     * The file is staged next to its target and moved into place, so readers see either the previous
     * document or the complete new one.
     */
    public Path write(CognitionProfile profile, Path destinationDir) throws WriteException {
        Objects.requireNonNull(profile, "profile must not be null");
        Objects.requireNonNull(destinationDir, "destinationDir must not be null");

        Path target = destinationDir.resolve(FILE_NAME);
        Path tmp = null;
        try {
            Files.createDirectories(destinationDir);
            // One staging file per write; concurrent writers never share it.
            tmp = Files.createTempFile(destinationDir, "cognition", ".md.tmp");
            Files.writeString(tmp, CognitionDocument.render(profile), StandardCharsets.UTF_8);
            move(tmp, target);
            LOG.debug("Wrote cognition document with {} bullets", profile.bulletCount());
            return target;
        } catch (IOException e) {
            if (tmp != null) {
                deleteQuietly(tmp, e);
            }
            throw new WriteException(target, e);
        }
    }

    private void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp, IOException failure) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }
}
