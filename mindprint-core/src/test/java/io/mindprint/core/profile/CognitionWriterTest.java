package io.mindprint.core.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mindprint.core.error.WriteException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CognitionWriterTest {

    @TempDir
    Path tempDir;

    private final CognitionWriter writer = new CognitionWriter();

    @Test
    void shouldCreateDirectoryAndWriteDocument() throws Exception {
        Path dir = tempDir.resolve("workspace/.mindprint");

        Path written = writer.write(CognitionProfile.empty(), dir);

        assertThat(written).isEqualTo(dir.resolve("cognition.md"));
        assertThat(Files.readString(written)).isEqualTo(CognitionDocument.render(CognitionProfile.empty()));
        try (var files = Files.list(dir)) {
            assertThat(files).containsExactly(written);
        }
    }

    @Test
    void shouldReplacePreviousDocument() throws Exception {
        writer.write(CognitionProfile.empty(), tempDir);
        CognitionProfile next = CognitionProfile.of(Map.of(
            SectionName.EXECUTION_TENDENCIES, List.of("Ships small increments behind feature flags")
        ));

        Path written = writer.write(next, tempDir);

        assertThat(CognitionDocument.parse(Files.readString(written))).isEqualTo(next);
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(written);
        }
    }

    @Test
    void concurrentWritersShouldEachPublishACompleteDocument() throws Exception {
        CognitionProfile first = CognitionProfile.of(Map.of(
            SectionName.LEARNING_STYLE, List.of("Learns new tools by reading the documentation first")
        ));
        CognitionProfile second = CognitionProfile.of(Map.of(
            SectionName.EXECUTION_TENDENCIES, List.of("Ships small increments behind feature flags")
        ));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<Path>> writes = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                writes.add(executor.submit(() -> writer.write(first, tempDir)));
                writes.add(executor.submit(() -> writer.write(second, tempDir)));
            }
            for (Future<Path> write : writes) {
                write.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Path target = tempDir.resolve(CognitionWriter.FILE_NAME);
        assertThat(CognitionDocument.parse(Files.readString(target))).isIn(first, second);
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void shouldWrapIoFailuresAsRetryableWriteException() throws Exception {
        Path blocker = tempDir.resolve("not-a-directory");
        Files.writeString(blocker, "x");

        assertThatThrownBy(() -> writer.write(CognitionProfile.empty(), blocker))
            .isInstanceOfSatisfying(WriteException.class, e -> {
                assertThat(e.retryable()).isTrue();
                assertThat(e.target()).isEqualTo(blocker.resolve("cognition.md"));
            });
    }
}
