package io.mindprint.core.redaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mindprint.core.error.RedactionException;
import java.util.List;
import org.junit.jupiter.api.Test;

class RedactorTest {

    private final Redactor redactor = new Redactor();

    @Test
    void shouldReplaceContactDetailsWithCategoryPlaceholders() throws Exception {
        RedactionResult result = redactor.redact(
            "Works with Jane Doe (jane@acme.com) on project Falcon, customer ACME-2024-001"
        );

        assertThat(result.text()).isEqualTo("Works with [NAME] ([EMAIL]) on project Falcon, customer [CUSTOMER_ID]");
        assertThat(result.count(RedactionCategory.NAME)).isEqualTo(1);
        assertThat(result.count(RedactionCategory.EMAIL)).isEqualTo(1);
        assertThat(result.count(RedactionCategory.CUSTOMER_ID)).isEqualTo(1);
        assertThat(result.total()).isEqualTo(3);
    }

    @Test
    void shouldRedactUrlWholeBeforeTheAddressInsideIt() throws Exception {
        RedactionResult result = redactor.redact("Dashboard lives at http://10.0.0.1:8080/admin for now");

        assertThat(result.text()).isEqualTo("Dashboard lives at [URL] for now");
        assertThat(result.count(RedactionCategory.URL)).isEqualTo(1);
        assertThat(result.count(RedactionCategory.IP_ADDRESS)).isZero();
    }

    @Test
    void shouldRedactBareAddressesSecretsPhonesAndDates() throws Exception {
        RedactionResult result = redactor.redact(
            "server at 192.168.1.20 uses api_key=abc123def456, call (555) 123-4567 before 2024-03-15"
        );

        assertThat(result.text())
            .contains("[IP_ADDRESS]", "[API_KEY]", "[PHONE]", "[DATE]")
            .doesNotContain("192.168", "abc123def456", "123-4567", "2024-03-15");
    }

    @Test
    void shouldRedactNameBrokenAcrossLines() throws Exception {
        RedactionResult result = redactor.redact("Paired with Jane\nDoe on the migration");

        assertThat(result.text()).isEqualTo("Paired with [NAME] on the migration");
        assertThat(result.count(RedactionCategory.NAME)).isEqualTo(1);
    }

    @Test
    void shouldTakeWholeRunOfCapitalisedWords() throws Exception {
        RedactionResult result = redactor.redact("Met Jane Doe at the offsite");

        assertThat(result.text()).isEqualTo("[NAME] at the offsite");
    }

    @Test
    void shouldRedactVendorKeys() throws Exception {
        RedactionResult result = redactor.redact("deploy key sk-live_abcdefghijklmnop1234 is rotated monthly");

        assertThat(result.text()).isEqualTo("deploy key [API_KEY] is rotated monthly");
    }

    @Test
    void shouldBeIdempotent() throws Exception {
        String input = "Mr. Smith emailed bob@example.org from 10.1.2.3 about INV-2023-77 on March 3, 2024";

        RedactionResult once = redactor.redact(input);
        RedactionResult twice = redactor.redact(once.text());

        assertThat(twice.text()).isEqualTo(once.text());
        assertThat(twice.total()).isZero();
    }

    @Test
    void shouldLeaveNoRuleMatchInOutput() throws Exception {
        RedactionResult result = redactor.redact("""
            Ping Alice Walker at alice.walker@corp.example or +1 415-555-0134.
            Office: 221 Baker Street, ticket #A-20391, card 4111 1111 1111 1111.
            """);

        for (RedactionRule rule : PatternCatalog.defaultCatalog().rules()) {
            assertThat(rule.matcher().matcher(result.text()).find())
                .as("rule %s", rule.name())
                .isFalse();
        }
    }

    @Test
    void shouldReturnEmptyTextForNullInput() throws Exception {
        RedactionResult result = redactor.redact(null);

        assertThat(result.text()).isEmpty();
        assertThat(result.counts()).isEmpty();
    }

    @Test
    void shouldFailWhenRedactionDoesNotSettle() {
        // Each pass exposes exactly one new "x[" in front of the previous placeholder.
        PatternCatalog catalog = new PatternCatalog(List.of(
            RedactionRule.of(RedactionCategory.NAME, "creeping", "x\\[")
        ));
        Redactor creeping = new Redactor(catalog);

        assertThatThrownBy(() -> creeping.redact("x".repeat(Redactor.MAX_PASSES * 2) + "["))
            .isInstanceOf(RedactionException.class)
            .hasMessageContaining("did not converge");
    }
}
