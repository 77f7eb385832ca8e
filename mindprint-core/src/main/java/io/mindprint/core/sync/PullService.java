package io.mindprint.core.sync;

import io.mindprint.core.error.MindprintException;
import io.mindprint.core.profile.CognitionWriter;
import io.mindprint.core.rental.RentalService;
import io.mindprint.core.rental.RentedPersona;
import io.mindprint.core.store.PersonaStore;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buyer side of a rental: redeems a token and materializes the persona under {@code <workspace>/personas}.
 */
public final class PullService {
    public static final String PERSONAS_DIR = "personas";

    private static final Logger LOG = LoggerFactory.getLogger(PullService.class);

    private final PersonaStore store;
    private final RentalService rentals;
    private final CognitionWriter writer;
    private final Installation installation;
    private final Clock clock;

    public PullService(
        PersonaStore store,
        RentalService rentals,
        CognitionWriter writer,
        Installation installation,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.rentals = Objects.requireNonNull(rentals, "rentals must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.installation = Objects.requireNonNull(installation, "installation must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public PullReport pull(String token, Path workspace, String buyerUserId) throws MindprintException {
        if (buyerUserId == null || buyerUserId.isBlank()) {
            throw new IllegalArgumentException("buyerUserId must not be blank");
        }
        store.upsertBuyer(installation.recordFor(buyerUserId, clock.instant()));

        RentedPersona persona = rentals.redeem(token);
        Path target = workspace.toAbsolutePath().normalize().resolve(PERSONAS_DIR).resolve(persona.personaId());
        Path document = writer.write(persona.profile(), target);
        LOG.info("Pulled persona {} ({} bullets)", persona.personaId(), persona.profile().bulletCount());
        return new PullReport(persona.personaId(), document, persona.profile().bulletCount());
    }
}
