package io.mindprint.core.error;

import java.nio.file.Path;

public final class WriteException extends MindprintException {
    private final Path target;

    public WriteException(Path target, Throwable cause) {
        super("Failed to write cognition document to " + target, cause);
        this.target = target;
    }

    public Path target() {
        return target;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
