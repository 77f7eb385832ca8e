package io.mindprint.core.redaction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record RedactionResult(String text, Map<RedactionCategory, Integer> counts) {

    public RedactionResult {
        text = text == null ? "" : text;
        EnumMap<RedactionCategory, Integer> copy = new EnumMap<>(RedactionCategory.class);
        if (counts != null) {
            counts.forEach((category, count) -> {
                if (count != null && count > 0) {
                    copy.put(category, count);
                }
            });
        }
        counts = Collections.unmodifiableMap(copy);
    }

    public int count(RedactionCategory category) {
        return counts.getOrDefault(category, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
