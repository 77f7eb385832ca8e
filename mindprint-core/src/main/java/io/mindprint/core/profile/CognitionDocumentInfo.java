package io.mindprint.core.profile;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Metadata about a cognition document on disk. {@code modelVersion} is empty when the file does not parse.
 */
public record CognitionDocumentInfo(
    Path path,
    long sizeBytes,
    int lines,
    int bullets,
    String modelVersion,
    Instant lastModified
) {
    public boolean valid() {
        return !modelVersion.isEmpty();
    }
}
