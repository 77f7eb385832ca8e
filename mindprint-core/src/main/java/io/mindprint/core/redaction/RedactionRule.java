package io.mindprint.core.redaction;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One row of the redaction table: every match of {@code matcher} is replaced by the category placeholder.
 */
public record RedactionRule(RedactionCategory category, String name, Pattern matcher) {

    public RedactionRule {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(matcher, "matcher must not be null");
        name = name == null || name.isBlank() ? category.name().toLowerCase() : name.trim();
    }

    public static RedactionRule of(RedactionCategory category, String name, String regex) {
        return new RedactionRule(category, name, Pattern.compile(regex));
    }

    public String placeholder() {
        return category.placeholder();
    }
}
