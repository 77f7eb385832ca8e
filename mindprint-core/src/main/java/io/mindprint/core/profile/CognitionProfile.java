package io.mindprint.core.profile;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Distilled, shareable profile: one section per {@link SectionName}, always in declaration order.
 */
public record CognitionProfile(List<CognitionSection> sections, String modelVersion) {
    public static final String MODEL_VERSION = "2.0";

    public CognitionProfile {
        Map<SectionName, CognitionSection> byName = new EnumMap<>(SectionName.class);
        if (sections != null) {
            for (CognitionSection section : sections) {
                if (byName.putIfAbsent(section.name(), section) != null) {
                    throw new IllegalArgumentException("Duplicate section " + section.name());
                }
            }
        }
        List<CognitionSection> ordered = new ArrayList<>(SectionName.values().length);
        for (SectionName name : SectionName.values()) {
            ordered.add(byName.getOrDefault(name, CognitionSection.empty(name)));
        }
        sections = List.copyOf(ordered);
        modelVersion = modelVersion == null || modelVersion.isBlank() ? MODEL_VERSION : modelVersion.trim();
    }

    public static CognitionProfile of(Map<SectionName, List<String>> bullets) {
        List<CognitionSection> sections = new ArrayList<>();
        bullets.forEach((name, lines) -> sections.add(new CognitionSection(name, lines)));
        return new CognitionProfile(sections, MODEL_VERSION);
    }

    public static CognitionProfile empty() {
        return new CognitionProfile(List.of(), MODEL_VERSION);
    }

    public CognitionSection section(SectionName name) {
        return sections.get(name.ordinal());
    }

    public int bulletCount() {
        return sections.stream().mapToInt(section -> section.bullets().size()).sum();
    }
}
