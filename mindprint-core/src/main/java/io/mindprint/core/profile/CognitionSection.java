package io.mindprint.core.profile;

import java.util.List;
import java.util.Objects;

public record CognitionSection(SectionName name, List<String> bullets) {

    public CognitionSection {
        Objects.requireNonNull(name, "name must not be null");
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
    }

    public static CognitionSection empty(SectionName name) {
        return new CognitionSection(name, List.of());
    }
}
