package io.mindprint.cli;

import io.mindprint.core.config.model.MindprintConfig;
import io.mindprint.core.error.RentalException;
import io.mindprint.core.rental.RentalService;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "rent", description = "Issue a rental token for a seller's cognition profile")
public final class RentCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Seller user id")
    String sellerUserId;

    @Option(names = "--ttl-hours", description = "Rental lifetime in hours (default from config)")
    Long ttlHours;

    @Option(names = "--no-expiry", description = "Issue a token that never expires")
    boolean noExpiry;

    public RentCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (noExpiry && ttlHours != null) {
                throw new IllegalArgumentException("--ttl-hours and --no-expiry cannot be combined");
            }
            MindprintConfig config = context.loadConfig();
            RentalService rentals = new RentalService(context.storeFactory().open(config), context.clock(), config.rental());
            String token;
            if (noExpiry) {
                token = rentals.issue(sellerUserId, null);
            } else if (ttlHours != null) {
                token = rentals.issue(sellerUserId, Duration.ofHours(ttlHours));
            } else {
                token = rentals.issue(sellerUserId);
            }
            System.out.println(token);
            return 0;
        } catch (RentalException e) {
            System.err.println(e.publicMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Rent failed: " + e.getMessage());
            return 1;
        }
    }
}
