package io.mindprint.core.distill;

import io.mindprint.core.profile.CognitionProfile;
import io.mindprint.core.redaction.RedactionCategory;
import java.util.Map;

/**
 * Outcome of one distillation run. Carries counts only; no source or redacted text.
 */
public record Distillation(
    CognitionProfile profile,
    Map<RedactionCategory, Integer> redactions,
    int keptLines,
    int droppedLines
) {
    public Distillation {
        redactions = redactions == null ? Map.of() : Map.copyOf(redactions);
    }
}
