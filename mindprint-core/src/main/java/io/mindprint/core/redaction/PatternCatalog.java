package io.mindprint.core.redaction;

import java.util.List;

/**
 * Ordered, immutable table of redaction rules.
 *
 * <p>Order is precedence: a rule earlier in the list consumes its span before any later rule sees it.
 * The default table puts the longer, more structured categories first, so a URL is taken whole before
 * the IP address inside it, and a customer reference before the digit runs inside it.
 */
public final class PatternCatalog {
    // Blanks, or a single line break, between the parts of a name.
    private static final String NAME_GAP = "(?:[ \\t]+|[ \\t]*\\r?\\n[ \\t]*)";

    private static final PatternCatalog DEFAULT = new PatternCatalog(List.of(
        RedactionRule.of(RedactionCategory.URL, "url",
            "(?i)\\b(?:https?|ftp|ssh|git)://[^\\s)\\]>\"'`]+|\\bwww\\.[^\\s)\\]>\"'`]+"),
        RedactionRule.of(RedactionCategory.EMAIL, "email",
            "(?i)\\b[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}\\b"),
        RedactionRule.of(RedactionCategory.API_KEY, "assigned-secret",
            "(?i)\\b(?:api[_-]?key|secret|token|password|passwd|bearer)\\s*[:=]\\s*['\"]?[a-z0-9_\\-.]+['\"]?"),
        RedactionRule.of(RedactionCategory.API_KEY, "vendor-key",
            "\\b(?:sk|pk|rk|ghp|gho|ghs|xox[abprs])[-_][A-Za-z0-9_-]{10,}\\b|\\bAKIA[0-9A-Z]{16}\\b"),
        RedactionRule.of(RedactionCategory.API_KEY, "jwt",
            "\\beyJ[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}"),
        RedactionRule.of(RedactionCategory.API_KEY, "high-entropy",
            "\\b(?=[A-Za-z0-9_-]*\\d)(?=[A-Za-z0-9_-]*[A-Za-z])[A-Za-z0-9_-]{32,}\\b"),
        RedactionRule.of(RedactionCategory.IP_ADDRESS, "ipv4",
            "\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b"),
        RedactionRule.of(RedactionCategory.IP_ADDRESS, "ipv6",
            "(?i)\\b(?:[0-9a-f]{1,4}:){7}[0-9a-f]{1,4}\\b"),
        RedactionRule.of(RedactionCategory.CUSTOMER_ID, "coded-reference",
            "\\b[A-Z]{2,10}-\\d{2,}(?:-[A-Z0-9]+)*\\b"),
        RedactionRule.of(RedactionCategory.CUSTOMER_ID, "labelled-reference",
            "(?i)\\b(?:customer|cust|client|account|acct|order|invoice|ticket)[\\s_#:-]*(?:id|no|number)?[\\s_#:-]*"
                + "[a-z0-9-]*\\d[a-z0-9-]*\\b"),
        RedactionRule.of(RedactionCategory.OTHER, "card-number",
            "\\b(?:\\d[ -]?){12,18}\\d\\b"),
        RedactionRule.of(RedactionCategory.OTHER, "national-id",
            "\\b\\d{3}-\\d{2}-\\d{4}\\b"),
        RedactionRule.of(RedactionCategory.DATE, "iso-date",
            "\\b\\d{4}-\\d{2}-\\d{2}(?:[ T]\\d{1,2}:\\d{2}(?::\\d{2})?)?\\b"),
        RedactionRule.of(RedactionCategory.DATE, "slash-date",
            "\\b\\d{1,2}/\\d{1,2}/\\d{2,4}\\b"),
        RedactionRule.of(RedactionCategory.DATE, "written-date",
            "(?i)\\b(?:jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2}(?:st|nd|rd|th)?"
                + "(?:,?\\s+\\d{4})?\\b"),
        RedactionRule.of(RedactionCategory.PHONE, "phone",
            "(?:\\+\\d{1,3}[\\s.-]?)?(?:\\(\\d{3}\\)|\\b\\d{3})[\\s.-]?\\d{3}[\\s.-]?\\d{4}\\b"),
        RedactionRule.of(RedactionCategory.ADDRESS, "street-address",
            "\\b\\d{1,5}[ \\t]+(?:[A-Z][a-z]+[ \\t]+){1,3}(?:Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd|Lane|Ln|Drive|Dr"
                + "|Court|Ct|Way|Place|Pl|Terrace|Square)\\b\\.?"),
        RedactionRule.of(RedactionCategory.NAME, "titled-name",
            "\\b(?:Mr|Mrs|Ms|Mx|Dr|Prof)\\.?" + NAME_GAP + "[A-Z][a-z]+(?:" + NAME_GAP + "[A-Z][a-z]+)?\\b"),
        RedactionRule.of(RedactionCategory.NAME, "full-name",
            "\\b[A-Z][a-z]+(?:" + NAME_GAP + "(?:[A-Z]\\." + NAME_GAP + ")?[A-Z][a-z]+(?:-[A-Z][a-z]+)?)+\\b")
    ));

    private final List<RedactionRule> rules;

    public PatternCatalog(List<RedactionRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("rules must not be empty");
        }
        this.rules = List.copyOf(rules);
        verifyPlaceholdersAreInert();
    }

    public static PatternCatalog defaultCatalog() {
        return DEFAULT;
    }

    public List<RedactionRule> rules() {
        return rules;
    }

    // A consumed span must never be matched again, otherwise redaction cannot converge.
    private void verifyPlaceholdersAreInert() {
        for (RedactionRule owner : rules) {
            for (RedactionRule rule : rules) {
                if (rule.matcher().matcher(owner.placeholder()).find()) {
                    throw new IllegalStateException(
                        "Rule " + rule.name() + " matches placeholder " + owner.placeholder()
                    );
                }
            }
        }
    }
}
