package io.mindprint.core.redaction;

import io.mindprint.core.error.RedactionException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Replaces every match of the catalog's rules with the rule's category placeholder.
 *
 * <p>Rules run in catalog order and passes repeat until one makes no replacement, so the returned
 * text is a fixpoint: no rule matches it, and redacting it again returns it unchanged. Any matcher
 * failure aborts the call; a partially redacted text is never returned.
 */
public final class Redactor {
    static final int MAX_PASSES = 8;

    private final PatternCatalog catalog;

    public Redactor() {
        this(PatternCatalog.defaultCatalog());
    }

    public Redactor(PatternCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    public RedactionResult redact(String input) throws RedactionException {
        if (input == null || input.isEmpty()) {
            return new RedactionResult("", Map.of());
        }

        Map<RedactionCategory, Integer> counts = new EnumMap<>(RedactionCategory.class);
        String current = input;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            boolean changed = false;
            for (RedactionRule rule : catalog.rules()) {
                Replacement replacement = apply(rule, current);
                if (replacement.count() > 0) {
                    counts.merge(rule.category(), replacement.count(), Integer::sum);
                    current = replacement.text();
                    changed = true;
                }
            }
            if (!changed) {
                return new RedactionResult(current, counts);
            }
        }
        throw new RedactionException("Redaction did not converge after " + MAX_PASSES + " passes");
    }

    private Replacement apply(RedactionRule rule, String text) throws RedactionException {
        try {
            Matcher matcher = rule.matcher().matcher(text);
            StringBuilder out = new StringBuilder(text.length());
            int count = 0;
            while (matcher.find()) {
                if (matcher.end() == matcher.start()) {
                    continue;
                }
                matcher.appendReplacement(out, Matcher.quoteReplacement(rule.placeholder()));
                count++;
            }
            if (count == 0) {
                return new Replacement(text, 0);
            }
            matcher.appendTail(out);
            return new Replacement(out.toString(), count);
        } catch (RuntimeException | StackOverflowError e) {
            throw new RedactionException("Redaction rule " + rule.name() + " failed", e);
        }
    }

    private record Replacement(String text, int count) {
    }
}
