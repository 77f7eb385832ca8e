package io.mindprint.core.profile;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical markdown form of a {@link CognitionProfile}. Every section is emitted, empty or not, and
 * the version line appears exactly once at the end.
 */
public final class CognitionDocument {
    public static final String TITLE = "# 🧠 Cognitive Profile";
    public static final String VERSION_PREFIX = "Cognition Model Version: ";

    private static final String SECTION_PREFIX = "## ";
    private static final String BULLET_PREFIX = "- ";

    private CognitionDocument() {
    }

    public static String render(CognitionProfile profile) {
        StringBuilder out = new StringBuilder();
        out.append(TITLE).append("\n");
        for (CognitionSection section : profile.sections()) {
            out.append("\n").append(SECTION_PREFIX).append(section.name().heading()).append("\n");
            for (String bullet : section.bullets()) {
                out.append(BULLET_PREFIX).append(singleLine(bullet)).append("\n");
            }
        }
        out.append("\n").append(VERSION_PREFIX).append(profile.modelVersion()).append("\n");
        return out.toString();
    }

    /**
     * Reads a rendered document back.
     *
     * @throws IllegalArgumentException if the text is not a cognition document
     */
    public static CognitionProfile parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cognition document is empty");
        }

        Map<SectionName, List<String>> bullets = new EnumMap<>(SectionName.class);
        SectionName current = null;
        String version = null;
        for (String raw : text.split("\\r?\\n")) {
            String line = raw.strip();
            if (line.startsWith(VERSION_PREFIX)) {
                if (version != null) {
                    throw new IllegalArgumentException("Cognition document has more than one version line");
                }
                version = line.substring(VERSION_PREFIX.length()).trim();
                current = null;
            } else if (line.startsWith(SECTION_PREFIX)) {
                String heading = line.substring(SECTION_PREFIX.length());
                current = SectionName.fromHeading(heading)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown cognition section: " + heading));
                bullets.computeIfAbsent(current, ignored -> new ArrayList<>());
            } else if (line.startsWith(BULLET_PREFIX) && current != null) {
                String bullet = line.substring(BULLET_PREFIX.length()).trim();
                if (!bullet.isEmpty()) {
                    bullets.get(current).add(bullet);
                }
            }
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Cognition document has no version line");
        }

        List<CognitionSection> sections = new ArrayList<>();
        bullets.forEach((name, lines) -> sections.add(new CognitionSection(name, lines)));
        return new CognitionProfile(sections, version);
    }

    private static String singleLine(String bullet) {
        return bullet == null ? "" : bullet.replaceAll("\\s+", " ").trim();
    }
}
