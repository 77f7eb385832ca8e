package io.mindprint.core.error;

import java.nio.file.Path;

public final class WorkspaceBusyException extends MindprintException {

    public WorkspaceBusyException(Path workspace) {
        super("Another sync is already running for " + workspace);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
