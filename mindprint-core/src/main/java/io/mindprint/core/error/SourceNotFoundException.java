package io.mindprint.core.error;

import java.nio.file.Path;

public final class SourceNotFoundException extends MindprintException {
    public static final String MESSAGE = "No memory files found.";

    private final Path location;

    public SourceNotFoundException(Path location) {
        super(MESSAGE);
        this.location = location;
    }

    public Path location() {
        return location;
    }
}
