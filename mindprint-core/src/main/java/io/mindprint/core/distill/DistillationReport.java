package io.mindprint.core.distill;

import io.mindprint.core.redaction.RedactionCategory;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public record DistillationReport(
    Path document,
    Map<RedactionCategory, Integer> redactions,
    int bullets,
    int droppedLines
) {
    public DistillationReport {
        redactions = redactions == null ? Map.of() : Map.copyOf(redactions);
    }

    public String redactionSummary() {
        if (redactions.isEmpty()) {
            return "";
        }
        return redactions.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .map(entry -> entry.getKey().name().toLowerCase(Locale.ROOT) + "=" + entry.getValue())
            .collect(Collectors.joining(", "));
    }
}
