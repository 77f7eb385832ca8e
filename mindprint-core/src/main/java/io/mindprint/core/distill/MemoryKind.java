package io.mindprint.core.distill;

/**
 * Kind of memory source. Declaration order is concatenation order: facts before events.
 */
public enum MemoryKind {
    FACT("MEMORY.md"),
    EVENT("HISTORY.md");

    private final String fileName;

    MemoryKind(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
