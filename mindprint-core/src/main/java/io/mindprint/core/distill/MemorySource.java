package io.mindprint.core.distill;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raw memory text, held only for the duration of one distillation run.
 */
public record MemorySource(MemoryKind kind, Path path, String text) {

    public MemorySource {
        Objects.requireNonNull(kind, "kind must not be null");
        text = text == null ? "" : text;
    }

    @Override
    public String toString() {
        return "MemorySource[kind=" + kind + ", path=" + path + ", chars=" + text.length() + "]";
    }
}
