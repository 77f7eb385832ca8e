package io.mindprint.core.redaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class PatternCatalogTest {

    @Test
    void defaultCatalogShouldOrderStructuredCategoriesFirst() {
        List<RedactionCategory> order = PatternCatalog.defaultCatalog().rules().stream()
            .map(RedactionRule::category)
            .distinct()
            .toList();

        assertThat(order).containsExactly(
            RedactionCategory.URL,
            RedactionCategory.EMAIL,
            RedactionCategory.API_KEY,
            RedactionCategory.IP_ADDRESS,
            RedactionCategory.CUSTOMER_ID,
            RedactionCategory.OTHER,
            RedactionCategory.DATE,
            RedactionCategory.PHONE,
            RedactionCategory.ADDRESS,
            RedactionCategory.NAME
        );
    }

    @Test
    void shouldRejectRuleThatMatchesAPlaceholder() {
        List<RedactionRule> rules = List.of(RedactionRule.of(RedactionCategory.OTHER, "greedy", "REDACTED"));

        assertThatThrownBy(() -> new PatternCatalog(rules))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("greedy");
    }

    @Test
    void shouldRejectEmptyRuleList() {
        assertThatThrownBy(() -> new PatternCatalog(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void everyCategoryShouldHaveADistinctPlaceholder() {
        assertThat(List.of(RedactionCategory.values()))
            .extracting(RedactionCategory::placeholder)
            .doesNotHaveDuplicates()
            .contains("[NAME]", "[EMAIL]", "[CUSTOMER_ID]", "[REDACTED]");
    }
}
