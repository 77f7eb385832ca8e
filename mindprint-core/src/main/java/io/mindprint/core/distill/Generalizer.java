package io.mindprint.core.distill;

import io.mindprint.core.redaction.RedactionCategory;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites redacted lines into abstract phrasing and rejects the ones it cannot make safe.
 *
 * <p>Known shapes are rephrased by a rule table ({@code "on project Falcon"} becomes {@code "on a project"},
 * {@code "with [NAME]"} becomes {@code "with a collaborator"}). A line that afterwards still carries a
 * placeholder, or a capitalised token that looks like a proper noun, is rejected: when in doubt, drop.
 *
 * <p>A capitalised word opening a sentence is only trusted when it is a common opener, an inflection of
 * a known verb, or a word the surrounding text also uses in lower case. Anything else, such as a first
 * name or a product name leading the sentence, rejects the line.
 */
public final class Generalizer {
    private static final Pattern PLACEHOLDER = Pattern.compile(
        Arrays.stream(RedactionCategory.values())
            .map(category -> Pattern.quote(category.placeholder()))
            .collect(Collectors.joining("|"))
    );
    private static final Pattern WORD = Pattern.compile("[A-Za-z][A-Za-z0-9'’_-]*");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?:;]");

    private static final List<Rewrite> REWRITES = List.of(
        rewrite("\\s*\\(\\s*\\[[A-Z_]+\\](?:\\s*[,;/]\\s*\\[[A-Z_]+\\])*\\s*\\)", match -> ""),
        rewrite("\\s*\\b(?i:on|at|by|since|until|before|after|from)\\s+\\[DATE\\]", match -> ""),
        rewrite("\\[?\\[DATE\\]\\]?\\s*[:\\-–]?\\s*", match -> ""),
        rewrite(",?\\s*\\b(?i:customer|client|account|order|invoice|ticket)\\s+\\[CUSTOMER_ID\\]", match -> ""),
        rewrite("\\[CUSTOMER_ID\\]", match -> "a customer account"),
        rewrite("\\b(?:(?i:the|our|my|their|a|an)\\s+)?((?i:project|product|client|customer|team|company|startup"
            + "|repo|repository|service|codename|app|platform))\\s+(?:[A-Z][\\w-]*|\\[[A-Z_]+\\])",
            match -> "a " + match.group(1).toLowerCase(Locale.ROOT)),
        rewrite("\\b((?i:with|alongside|for|from|to|and))\\s+\\[NAME\\](?:\\s*(?:,|and|&)\\s*\\[NAME\\])*",
            match -> match.group(1) + (match.group().indexOf("[NAME]") != match.group().lastIndexOf("[NAME]")
                ? " several collaborators"
                : " a collaborator"))
    );

    private static final List<Rewrite> CLEANUP = List.of(
        rewrite("\\(\\s*\\)", match -> ""),
        rewrite("\\s+([,.;:!?])", match -> match.group(1)),
        rewrite("([,;:])(?:\\s*[,;:])+", match -> match.group(1)),
        rewrite("\\s{2,}", match -> " "),
        rewrite("^[\\s,;:\\-–]+", match -> ""),
        rewrite("[\\s,;:\\-–]+$", match -> "")
    );

    private static final Set<String> GENERIC_TERMS = Set.of(
        "I", "I'm", "I've", "I'd", "I'll", "OK",
        "API", "APIs", "SQL", "HTTP", "HTTPS", "REST", "JSON", "YAML", "XML", "CSV", "PDF",
        "CI", "CD", "CLI", "UI", "UX", "TDD", "BDD", "QA", "PR", "PRs", "AI", "ML", "LLM", "LLMs",
        "MVP", "KPI", "KPIs", "OKR", "OKRs", "SLA", "SLO", "SLOs", "DB", "OS", "IDE", "CPU", "GPU", "RFC", "RFCs",
        "Java", "Python", "JavaScript", "TypeScript", "Go", "Rust", "Kotlin", "Git", "Linux", "Docker",
        "Kubernetes", "Markdown"
    );

    private static final Set<String> SENTENCE_OPENERS = Set.of(
        "a", "an", "the", "this", "that", "these", "those", "it", "its", "he", "she", "they", "we", "you",
        "my", "our", "their", "his", "her", "one", "when", "while", "if", "once", "after", "before", "during",
        "since", "until", "because", "although", "though", "as", "for", "from", "in", "on", "at", "by", "with",
        "without", "to", "into", "of", "and", "but", "or", "so", "then", "also", "often", "usually", "always",
        "never", "sometimes", "rarely", "generally", "mostly", "typically", "very", "most", "more", "less",
        "some", "many", "few", "each", "every", "all", "both", "no", "not", "new", "small", "large", "early",
        "late", "strong", "good", "great", "highly", "deeply", "quickly", "carefully", "regularly",
        "frequently", "consistently", "first", "next", "finally", "here", "there", "what", "how", "why",
        "where", "which", "led", "built", "wrote", "ran", "took", "made", "gave", "got", "kept", "spent",
        "thought", "learnt", "chose", "broke", "drove", "sought", "taught", "read"
    );

    private static final Set<String> VERB_STEMS = Set.of(
        "think", "learn", "work", "ship", "automate", "weigh", "pair", "prefer", "decide", "read", "write",
        "build", "break", "test", "plan", "debug", "review", "ask", "lead", "mentor", "teach", "explore",
        "prototype", "iterate", "experiment", "focus", "favour", "favor", "value", "enjoy", "like", "use",
        "keep", "start", "avoid", "question", "challenge", "document", "refactor", "deliver", "deploy",
        "migrate", "measure", "track", "analyse", "analyze", "communicate", "collaborate", "delegate",
        "prioritise", "prioritize", "validate", "verify", "check", "seek", "look", "need", "tend", "reason",
        "solve", "design", "architect", "simplify", "default", "rely", "trust", "approach", "handle", "manage",
        "own", "drive", "run", "take", "make", "give", "get", "set", "balance", "compare", "research", "study",
        "practise", "practice", "revisit", "reflect", "sketch", "draft", "spend", "treat", "combine", "shift",
        "move", "switch", "adapt", "invest", "notice", "remember", "struggle", "stay", "wait", "push", "split",
        "cut", "debrief", "pause", "step", "rewrite", "rebuild", "investigate", "troubleshoot",
        "clarify", "estimate", "schedule", "batch", "commit", "release", "launch", "onboard", "coach"
    );

    private static final List<String> INFLECTIONS = List.of("ing", "es", "ed", "s", "d");

    public Optional<String> generalize(String redactedLine) {
        return generalize(redactedLine, Set.of());
    }

    /**
     * Generalizes a line, trusting a sentence-opening capitalised word whose lower-case form is in
     * {@code vocabulary}.
     */
    public Optional<String> generalize(String redactedLine, Set<String> vocabulary) {
        if (redactedLine == null || redactedLine.isBlank()) {
            return Optional.empty();
        }
        String line = redactedLine.strip();
        for (Rewrite rewrite : REWRITES) {
            line = rewrite.apply(line);
        }
        for (Rewrite rewrite : CLEANUP) {
            line = rewrite.apply(line);
        }
        if (line.isEmpty() || PLACEHOLDER.matcher(line).find() || hasProperNoun(line, vocabulary)) {
            return Optional.empty();
        }
        return Optional.of(Character.toUpperCase(line.charAt(0)) + line.substring(1));
    }

    /**
     * Collects the words {@code text} uses in lower case.
     */
    public static Set<String> lowercaseVocabulary(String text) {
        Set<String> words = new HashSet<>();
        if (text == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            String token = matcher.group();
            if (Character.isLowerCase(token.charAt(0))) {
                words.add(token.toLowerCase(Locale.ROOT));
            }
        }
        return words;
    }

    private boolean hasProperNoun(String line, Set<String> vocabulary) {
        Matcher matcher = WORD.matcher(line);
        int previousEnd = 0;
        while (matcher.find()) {
            String gap = line.substring(previousEnd, matcher.start());
            boolean sentenceStart = previousEnd == 0 || SENTENCE_BREAK.matcher(gap).find();
            previousEnd = matcher.end();

            String token = matcher.group();
            if (GENERIC_TERMS.contains(token) || !Character.isUpperCase(token.charAt(0))) {
                continue;
            }
            boolean plainCapitalised = token.substring(1).chars().noneMatch(Character::isUpperCase);
            if (!sentenceStart || !plainCapitalised) {
                return true;
            }
            String lower = token.toLowerCase(Locale.ROOT);
            if (!vocabulary.contains(lower) && !isCommonOpener(lower)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isCommonOpener(String word) {
        if (SENTENCE_OPENERS.contains(word) || VERB_STEMS.contains(word)) {
            return true;
        }
        for (String suffix : INFLECTIONS) {
            if (word.length() <= suffix.length() + 1 || !word.endsWith(suffix)) {
                continue;
            }
            String stem = word.substring(0, word.length() - suffix.length());
            if (VERB_STEMS.contains(stem) || VERB_STEMS.contains(stem + "e")) {
                return true;
            }
            int last = stem.length() - 1;
            if (stem.charAt(last) == stem.charAt(last - 1) && VERB_STEMS.contains(stem.substring(0, last))) {
                return true;
            }
            if (stem.charAt(last) == 'i' && VERB_STEMS.contains(stem.substring(0, last) + "y")) {
                return true;
            }
        }
        return false;
    }

    private static Rewrite rewrite(String regex, Function<MatchResult, String> replacement) {
        return new Rewrite(Pattern.compile(regex), replacement);
    }

    private record Rewrite(Pattern pattern, Function<MatchResult, String> replacement) {
        String apply(String input) {
            return pattern.matcher(input).replaceAll(match -> Matcher.quoteReplacement(replacement.apply(match)));
        }
    }
}
