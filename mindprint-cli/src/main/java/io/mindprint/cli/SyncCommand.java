package io.mindprint.cli;

import io.mindprint.core.config.model.MindprintConfig;
import io.mindprint.core.error.SourceNotFoundException;
import io.mindprint.core.store.PersonaStore;
import io.mindprint.core.sync.Installation;
import io.mindprint.core.sync.SyncReport;
import io.mindprint.core.sync.SyncService;
import io.mindprint.core.sync.WorkspaceLock;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "sync", description = "Publish this workspace's cognition profile as your seller asset")
public final class SyncCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-w", "--workspace"}, defaultValue = ".", description = "Workspace directory")
    Path workspace;

    public SyncCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MindprintConfig config = context.loadConfig();
            Installation host = context.installation().get();
            PersonaStore store = context.storeFactory().open(config);
            SyncService service = new SyncService(
                store,
                context.distillationService(config),
                new WorkspaceLock(config.distill().outputDirName(), Duration.ofMillis(config.store().busyTimeoutMillis())),
                host,
                context.clock()
            );
            SyncReport report = service.sync(workspace, context.userId(config, host));
            System.out.println("Synced " + report.document() + " (" + report.bullets() + " bullets)");
            System.out.println("Seller id: " + report.sellerUserId());
            return 0;
        } catch (SourceNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Sync failed: " + e.getMessage());
            return 1;
        }
    }
}
