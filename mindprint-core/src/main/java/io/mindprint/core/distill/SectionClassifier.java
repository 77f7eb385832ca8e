package io.mindprint.core.distill;

import io.mindprint.core.profile.SectionName;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps a redacted line to a cognition section using an ordered keyword table. The first matching row
 * wins; a line that matches no row is discarded rather than put in a catch-all section.
 */
public final class SectionClassifier {
    public static final int DEFAULT_MIN_TOKENS = 4;

    private static final List<SectionRule> RULES = List.of(
        rule(SectionName.CORE_THINKING_PATTERNS,
            "think\\w*|first[- ]principles?|mental models?|patterns?\\b|abstract\\w*|systematic\\w*|root[- ]cause"
                + "|big[- ]picture|frameworks?\\b|principles?\\b|architect\\w*|design\\w*|reason(?:s|ing)?\\b"),
        rule(SectionName.DECISION_APPROACH,
            "decid\\w*|decision\\w*|risk\\w*|trade-?offs?|validat\\w*|evidence|data-driven|prioriti[sz]\\w*"
                + "|weigh\\w*|choos\\w*|chose\\b|options?\\b|cost[- ]benefit|reversib\\w*|assumptions?\\b"),
        rule(SectionName.LEARNING_STYLE,
            "learn\\w*|experiment\\w*|iterat\\w*|prototyp\\w*|hands-on|read(?:s|ing)?\\b|documentation|tutorials?"
                + "|feedback|practi[cs]\\w*|explor\\w*|curio\\w*|stud(?:y|ies|ying)\\b|insights?\\b|realiz\\w*"
                + "|discover\\w*"),
        rule(SectionName.EXECUTION_TENDENCIES,
            "ship(?:s|ped|ping)?\\b|deliver\\w*|deadlines?|automat\\w*|workflows?|checklists?|incremental\\w*"
                + "|test(?:s|ed|ing)?\\b|refactor\\w*|plan(?:s|ned|ning)?\\b|execut\\w*|routines?|pipelines?"
                + "|small batches|focus\\w*|timebox\\w*"),
        rule(SectionName.COGNITIVE_STRENGTHS,
            "strengths?|good at|excel\\w*|skilled|expert\\w*|strong\\w*|debug\\w*|analy[sz]\\w*|communicat\\w*"
                + "|synthes\\w*|detail-oriented|attention to detail|troubleshoot\\w*"),
        rule(SectionName.EXPERIENCE_THEMES,
            "projects?\\b|teams?\\b|collaborat\\w*|clients?\\b|customers?\\b|migrat\\w*|launch\\w*|worked\\b"
                + "|works with|experience\\w*|led\\b|lead(?:s|ing)?\\b|mentor\\w*|startups?|industr\\w*"
                + "|stakeholders?|domains?\\b|onboard\\w*")
    );

    private static final List<Pattern> BLOCKLIST = List.of(
        Pattern.compile("^\\(.*\\)$"),
        Pattern.compile("(?i)^(?:todo|tbd|n/?a|none|nothing(?: yet)?|placeholder|lorem ipsum)\\b"),
        Pattern.compile("(?i)^(?:this (?:file|document)|generated (?:by|on)|last updated)\\b"),
        Pattern.compile("(?i)\\b(?:important facts about the user|user preferences learned over time"
            + "|information about ongoing projects|things to remember)\\b")
    );

    private final int minTokens;

    public SectionClassifier() {
        this(DEFAULT_MIN_TOKENS);
    }

    public SectionClassifier(int minTokens) {
        if (minTokens < 1) {
            throw new IllegalArgumentException("minTokens must be >= 1");
        }
        this.minTokens = minTokens;
    }

    public Optional<SectionName> classify(String redactedLine) {
        if (redactedLine == null || redactedLine.isBlank()) {
            return Optional.empty();
        }
        String line = redactedLine.strip();
        if (tokenCount(line) < minTokens || isBoilerplate(line)) {
            return Optional.empty();
        }
        for (SectionRule rule : RULES) {
            if (rule.keywords().matcher(line).find()) {
                return Optional.of(rule.section());
            }
        }
        return Optional.empty();
    }

    private boolean isBoilerplate(String line) {
        for (Pattern pattern : BLOCKLIST) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

    private int tokenCount(String line) {
        int count = 0;
        for (String token : line.split("\\s+")) {
            if (token.chars().anyMatch(Character::isLetter)) {
                count++;
            }
        }
        return count;
    }

    private static SectionRule rule(SectionName section, String keywords) {
        return new SectionRule(section, Pattern.compile("(?i)\\b(?:" + keywords + ")"));
    }

    private record SectionRule(SectionName section, Pattern keywords) {
    }
}
