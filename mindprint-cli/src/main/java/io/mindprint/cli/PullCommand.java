package io.mindprint.cli;

import io.mindprint.core.config.model.MindprintConfig;
import io.mindprint.core.error.RentalException;
import io.mindprint.core.profile.CognitionWriter;
import io.mindprint.core.rental.RentalService;
import io.mindprint.core.store.PersonaStore;
import io.mindprint.core.sync.Installation;
import io.mindprint.core.sync.PullReport;
import io.mindprint.core.sync.PullService;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "pull", description = "Redeem a rental token and install the persona")
public final class PullCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Rental token")
    String token;

    @Option(names = {"-w", "--workspace"}, defaultValue = ".", description = "Workspace directory")
    Path workspace;

    public PullCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MindprintConfig config = context.loadConfig();
            Installation host = context.installation().get();
            PersonaStore store = context.storeFactory().open(config);
            RentalService rentals = new RentalService(store, context.clock(), config.rental());
            PullService service = new PullService(store, rentals, new CognitionWriter(), host, context.clock());
            PullReport report = service.pull(token, workspace, context.userId(config, host));
            System.out.println("Persona " + report.personaId() + " installed at " + report.document());
            return 0;
        } catch (RentalException e) {
            System.err.println(e.publicMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Pull failed: " + e.getMessage());
            return 1;
        }
    }
}
