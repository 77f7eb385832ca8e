package io.mindprint.cli;

import io.mindprint.core.config.model.MindprintConfig;
import io.mindprint.core.rental.RentalService;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "revoke", description = "Revoke a rental token")
public final class RevokeCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Rental token")
    String token;

    public RevokeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MindprintConfig config = context.loadConfig();
            RentalService rentals = new RentalService(context.storeFactory().open(config), context.clock(), config.rental());
            boolean revoked = rentals.revoke(token);
            System.out.println(revoked ? "Rental revoked." : "Rental is not active; nothing to revoke.");
            return 0;
        } catch (Exception e) {
            System.err.println("Revoke failed: " + e.getMessage());
            return 1;
        }
    }
}
