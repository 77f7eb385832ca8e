package io.mindprint.core.profile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CognitionIndex {
    private static final Logger LOG = LoggerFactory.getLogger(CognitionIndex.class);
    private static final int MAX_DEPTH = 12;

    private final String outputDirName;

    public CognitionIndex(String outputDirName) {
        this.outputDirName = Objects.requireNonNull(outputDirName, "outputDirName must not be null");
    }

    /**
     * Finds every {@code <outputDirName>/cognition.md} below {@code root}, sorted by path.
     */
    public List<CognitionDocumentInfo> list(Path root) throws IOException {
        if (root == null || !Files.isDirectory(root)) {
            return List.of();
        }
        List<Path> documents;
        try (Stream<Path> walk = Files.walk(root, MAX_DEPTH)) {
            documents = walk
                .filter(Files::isRegularFile)
                .filter(this::isCognitionDocument)
                .sorted(Comparator.naturalOrder())
                .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        List<CognitionDocumentInfo> infos = new ArrayList<>(documents.size());
        for (Path document : documents) {
            try {
                infos.add(describe(document));
            } catch (IOException e) {
                LOG.warn("Skipping unreadable cognition document {}", document, e);
            }
        }
        return infos;
    }

    private boolean isCognitionDocument(Path path) {
        Path parent = path.getParent();
        return CognitionWriter.FILE_NAME.equals(path.getFileName().toString())
            && parent != null
            && parent.getFileName() != null
            && outputDirName.equals(parent.getFileName().toString());
    }

    private CognitionDocumentInfo describe(Path document) throws IOException {
        String content = Files.readString(document, StandardCharsets.UTF_8);
        int bullets = 0;
        String version = "";
        try {
            CognitionProfile profile = CognitionDocument.parse(content);
            bullets = profile.bulletCount();
            version = profile.modelVersion();
        } catch (IllegalArgumentException e) {
            LOG.debug("Cognition document {} does not parse: {}", document, e.getMessage());
        }
        return new CognitionDocumentInfo(
            document,
            Files.size(document),
            (int) content.lines().count(),
            bullets,
            version,
            Files.getLastModifiedTime(document).toInstant()
        );
    }
}
