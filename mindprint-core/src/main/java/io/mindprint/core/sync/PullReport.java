package io.mindprint.core.sync;

import java.nio.file.Path;

public record PullReport(String personaId, Path document, int bullets) {
}
