package io.mindprint.core.distill;

import io.mindprint.core.error.SourceNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class MemorySourceLoader {

    /**
     * Reads {@code MEMORY.md} and {@code HISTORY.md} from {@code directory}. At least one must exist.
     */
    public List<MemorySource> load(Path directory) throws SourceNotFoundException, IOException {
        List<MemorySource> sources = new ArrayList<>(2);
        for (MemoryKind kind : MemoryKind.values()) {
            Path file = directory.resolve(kind.fileName());
            if (Files.isRegularFile(file)) {
                sources.add(new MemorySource(kind, file, Files.readString(file, StandardCharsets.UTF_8)));
            }
        }
        if (sources.isEmpty()) {
            throw new SourceNotFoundException(directory);
        }
        return sources;
    }

    public boolean hasSources(Path directory) {
        for (MemoryKind kind : MemoryKind.values()) {
            if (Files.isRegularFile(directory.resolve(kind.fileName()))) {
                return true;
            }
        }
        return false;
    }
}
