package io.mindprint.core.profile;

import java.util.Optional;

/**
 * The fixed, exhaustive set of cognition sections, in document order.
 */
public enum SectionName {
    CORE_THINKING_PATTERNS("Core Thinking Patterns"),
    DECISION_APPROACH("Decision Approach"),
    LEARNING_STYLE("Learning Style"),
    EXECUTION_TENDENCIES("Execution Tendencies"),
    COGNITIVE_STRENGTHS("Cognitive Strengths"),
    EXPERIENCE_THEMES("Generalized Experience Themes");

    private final String heading;

    SectionName(String heading) {
        this.heading = heading;
    }

    public String heading() {
        return heading;
    }

    public static Optional<SectionName> fromHeading(String heading) {
        if (heading == null) {
            return Optional.empty();
        }
        String trimmed = heading.trim();
        for (SectionName name : values()) {
            if (name.heading.equalsIgnoreCase(trimmed)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
