package io.mindprint.core.distill;

import static org.assertj.core.api.Assertions.assertThat;

import io.mindprint.core.profile.SectionName;
import org.junit.jupiter.api.Test;

class SectionClassifierTest {

    private final SectionClassifier classifier = new SectionClassifier();

    @Test
    void shouldClassifyByFirstMatchingKeywordRow() {
        assertThat(classifier.classify("Thinks in first principles before writing code"))
            .contains(SectionName.CORE_THINKING_PATTERNS);
        assertThat(classifier.classify("Weighs trade-offs carefully before committing"))
            .contains(SectionName.DECISION_APPROACH);
        assertThat(classifier.classify("Learns fastest by building small prototypes"))
            .contains(SectionName.LEARNING_STYLE);
        assertThat(classifier.classify("Ships in small batches with a checklist"))
            .contains(SectionName.EXECUTION_TENDENCIES);
        assertThat(classifier.classify("Very good at debugging flaky integration suites"))
            .contains(SectionName.COGNITIVE_STRENGTHS);
        assertThat(classifier.classify("Works with a collaborator on a project"))
            .contains(SectionName.EXPERIENCE_THEMES);
    }

    @Test
    void shouldDiscardShortLines() {
        assertThat(classifier.classify("Thinks visually")).isEmpty();
        assertThat(new SectionClassifier(2).classify("Thinks visually")).contains(SectionName.CORE_THINKING_PATTERNS);
    }

    @Test
    void shouldDiscardTemplateBoilerplate() {
        assertThat(classifier.classify("(Things to remember about the project)")).isEmpty();
        assertThat(classifier.classify("TODO: describe how decisions are made")).isEmpty();
        assertThat(classifier.classify("Information about ongoing projects and tasks")).isEmpty();
    }

    @Test
    void shouldNotDefaultUnmatchedLinesIntoASection() {
        assertThat(classifier.classify("Enjoys long walks in the park")).isEmpty();
        assertThat(classifier.classify("   ")).isEmpty();
        assertThat(classifier.classify(null)).isEmpty();
    }
}
