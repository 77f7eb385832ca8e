package io.mindprint.core.distill;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mindprint.core.error.SourceNotFoundException;
import io.mindprint.core.profile.CognitionDocument;
import io.mindprint.core.profile.CognitionWriter;
import io.mindprint.core.redaction.RedactionCategory;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DistillationServiceTest {

    @TempDir
    Path tempDir;

    private final DistillationService service = new DistillationService(
        new MemorySourceLoader(),
        new Distiller(),
        new CognitionWriter(),
        ".mindprint"
    );

    @Test
    void shouldWriteDocumentToDefaultOutputDirectory() throws Exception {
        Files.writeString(tempDir.resolve("MEMORY.md"), "- Works with Jane Doe on project Falcon every sprint\n");

        DistillationReport report = service.distill(tempDir, null);

        Path expected = tempDir.toAbsolutePath().normalize().resolve(".mindprint").resolve(CognitionWriter.FILE_NAME);
        assertThat(report.document()).isEqualTo(expected);
        assertThat(report.bullets()).isEqualTo(1);
        assertThat(report.redactions()).containsEntry(RedactionCategory.NAME, 1);
        assertThat(report.redactionSummary()).isEqualTo("name=1");

        String content = Files.readString(expected);
        assertThat(content).startsWith(CognitionDocument.TITLE).doesNotContain("Jane", "Falcon");
        assertThat(content).contains("- Works with a collaborator on a project every sprint");
    }

    @Test
    void shouldHonourExplicitOutputDirectory() throws Exception {
        Files.writeString(tempDir.resolve("HISTORY.md"), "Learns best from direct code review feedback\n");
        Path out = tempDir.resolve("exports/profile");

        DistillationReport report = service.distill(tempDir, out);

        assertThat(report.document()).isEqualTo(out.toAbsolutePath().normalize().resolve(CognitionWriter.FILE_NAME));
        assertThat(Files.exists(report.document())).isTrue();
        assertThat(report.redactionSummary()).isEmpty();
    }

    @Test
    void shouldFailWithoutSourcesAndWriteNothing() {
        assertThatThrownBy(() -> service.distill(tempDir, null))
            .isInstanceOf(SourceNotFoundException.class)
            .hasMessage("No memory files found.");

        assertThat(Files.exists(tempDir.resolve(".mindprint"))).isFalse();
    }
}
