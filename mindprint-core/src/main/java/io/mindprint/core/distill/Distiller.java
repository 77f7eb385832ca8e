package io.mindprint.core.distill;

import io.mindprint.core.error.RedactionException;
import io.mindprint.core.profile.CognitionProfile;
import io.mindprint.core.profile.SectionName;
import io.mindprint.core.redaction.RedactionResult;
import io.mindprint.core.redaction.Redactor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redact-then-classify pipeline turning memory sources into a {@link CognitionProfile}.
 *
 * <p>The concatenated sources are redacted as one text before any line is split out or classified,
 * so a name broken across adjacent lines is still caught and no unredacted line reaches the classifier.
 */
public final class Distiller {
    public static final int DEFAULT_MAX_BULLETS_PER_SECTION = 10;

    private static final Logger LOG = LoggerFactory.getLogger(Distiller.class);
    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*+•]|\\d+[.)])\\s+");
    private static final Pattern CHECKBOX = Pattern.compile("^\\[[ xX]\\]\\s+");
    private static final Pattern EMPHASIS = Pattern.compile("\\*\\*|__|`");
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+(?=[A-Z\\[])");

    private final Redactor redactor;
    private final Generalizer generalizer;
    private final SectionClassifier classifier;
    private final int maxBulletsPerSection;

    public Distiller() {
        this(new Redactor(), new Generalizer(), new SectionClassifier(), DEFAULT_MAX_BULLETS_PER_SECTION);
    }

    public Distiller(Redactor redactor, Generalizer generalizer, SectionClassifier classifier, int maxBulletsPerSection) {
        this.redactor = Objects.requireNonNull(redactor, "redactor must not be null");
        this.generalizer = Objects.requireNonNull(generalizer, "generalizer must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        if (maxBulletsPerSection < 1) {
            throw new IllegalArgumentException("maxBulletsPerSection must be >= 1");
        }
        this.maxBulletsPerSection = maxBulletsPerSection;
    }

    public CognitionProfile distill(List<MemorySource> sources) throws RedactionException {
        return run(sources).profile();
    }

    public Distillation run(List<MemorySource> sources) throws RedactionException {
        RedactionResult redaction = redactor.redact(concatenate(sources));

        Map<SectionName, Map<String, String>> buckets = new EnumMap<>(SectionName.class);
        for (SectionName name : SectionName.values()) {
            buckets.put(name, new LinkedHashMap<>());
        }

        Set<String> vocabulary = Generalizer.lowercaseVocabulary(redaction.text());
        int kept = 0;
        int dropped = 0;
        for (String candidate : candidates(redaction.text())) {
            Optional<String> generalized = generalizer.generalize(candidate, vocabulary);
            Optional<SectionName> section = generalized.flatMap(classifier::classify);
            if (section.isEmpty()) {
                dropped++;
                continue;
            }
            Map<String, String> bucket = buckets.get(section.get());
            String key = generalized.get().toLowerCase(Locale.ROOT);
            if (bucket.containsKey(key) || bucket.size() >= maxBulletsPerSection) {
                dropped++;
                continue;
            }
            bucket.put(key, generalized.get());
            kept++;
        }

        Map<SectionName, List<String>> bullets = new EnumMap<>(SectionName.class);
        buckets.forEach((name, bucket) -> bullets.put(name, List.copyOf(bucket.values())));
        CognitionProfile profile = CognitionProfile.of(bullets);

        LOG.debug("Distilled {} lines into {} bullets ({} dropped, {} redactions)",
            kept + dropped, profile.bulletCount(), dropped, redaction.total());
        return new Distillation(profile, redaction.counts(), kept, dropped);
    }

    private String concatenate(List<MemorySource> sources) {
        if (sources == null || sources.isEmpty()) {
            return "";
        }
        return sources.stream()
            .sorted(Comparator.comparing(MemorySource::kind))
            .map(MemorySource::text)
            .collect(Collectors.joining("\n\n"));
    }

    private List<String> candidates(String redacted) {
        List<String> out = new ArrayList<>();
        boolean inCodeBlock = false;
        for (String raw : redacted.split("\\r?\\n")) {
            String line = raw.strip();
            if (line.startsWith("```")) {
                inCodeBlock = !inCodeBlock;
                continue;
            }
            if (inCodeBlock || line.isEmpty() || line.startsWith("#") || line.startsWith("|")
                || line.startsWith("<!--") || line.startsWith(">") || line.matches("^[-*_=]{3,}$")) {
                continue;
            }
            line = LIST_MARKER.matcher(line).replaceFirst("");
            line = CHECKBOX.matcher(line).replaceFirst("");
            line = EMPHASIS.matcher(line).replaceAll("");
            for (String sentence : SENTENCE_SPLIT.split(line)) {
                String trimmed = sentence.strip();
                if (!trimmed.isEmpty()) {
                    out.add(trimmed);
                }
            }
        }
        return out;
    }
}
