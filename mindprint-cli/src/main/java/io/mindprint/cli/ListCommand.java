package io.mindprint.cli;

import io.mindprint.core.config.model.MindprintConfig;
import io.mindprint.core.profile.CognitionDocumentInfo;
import io.mindprint.core.profile.CognitionIndex;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "list", description = "List cognition documents under a directory")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", defaultValue = ".", description = "Directory to search")
    Path path;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MindprintConfig config = context.loadConfig();
            List<CognitionDocumentInfo> documents = new CognitionIndex(config.distill().outputDirName()).list(path);
            if (documents.isEmpty()) {
                System.out.println("No cognition documents found.");
                return 0;
            }
            for (CognitionDocumentInfo info : documents) {
                System.out.printf(
                    "%s  size=%dB lines=%d bullets=%d version=%s modified=%s%n",
                    info.path(),
                    info.sizeBytes(),
                    info.lines(),
                    info.bullets(),
                    info.valid() ? info.modelVersion() : "invalid",
                    info.lastModified()
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("List failed: " + e.getMessage());
            return 1;
        }
    }
}
