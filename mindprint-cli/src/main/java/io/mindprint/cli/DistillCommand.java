package io.mindprint.cli;

import io.mindprint.core.config.model.MindprintConfig;
import io.mindprint.core.distill.DistillationReport;
import io.mindprint.core.error.SourceNotFoundException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "distill", description = "Distill MEMORY.md and HISTORY.md into a redacted cognition profile")
public final class DistillCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", defaultValue = ".", description = "Directory holding the memory files")
    Path path;

    @Parameters(index = "1", arity = "0..1", description = "Output directory (default: <path>/.mindprint)")
    Path outputDir;

    public DistillCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MindprintConfig config = context.loadConfig();
            DistillationReport report = context.distillationService(config).distill(path, outputDir);
            System.out.println(report.document());
            String summary = report.redactionSummary();
            System.out.println(summary.isEmpty()
                ? "Bullets: " + report.bullets() + ", nothing redacted"
                : "Bullets: " + report.bullets() + ", redacted: " + summary);
            return 0;
        } catch (SourceNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Distill failed: " + e.getMessage());
            return 1;
        }
    }
}
