package io.mindprint.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.mindprint.core.config.ConfigService;
import io.mindprint.core.rental.RentalService;
import io.mindprint.core.store.SqlitePersonaStore;
import io.mindprint.core.sync.Installation;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MindprintCliTest {

    private static final String USER = "hw-user";

    @TempDir
    Path tempDir;

    private CliContext context;

    @BeforeEach
    void setUp() {
        context = new CliContext(
            new ConfigService(Map.of()),
            tempDir.resolve("home/config.json"),
            config -> new SqlitePersonaStore(tempDir.resolve("home/mindprint.db"), Duration.ofSeconds(1)),
            () -> new Installation(USER, "fp-test", Map.of("osName", "Linux")),
            Clock.fixed(Instant.parse("2026-06-01T10:00:00Z"), ZoneOffset.UTC)
        );
    }

    @Test
    void distillShouldReportMissingMemoryOnStderr() throws Exception {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        Result result = run("distill", empty.toString());

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("No memory files found.");
        assertThat(result.out()).isEmpty();
        assertThat(empty.resolve(".mindprint")).doesNotExist();
    }

    @Test
    void distillShouldPrintDocumentPathAndRedactionSummary() throws Exception {
        Path workspace = Files.createDirectories(tempDir.resolve("ws"));
        Files.writeString(workspace.resolve("MEMORY.md"),
            "- Works with Jane Doe (jane@acme.com) on project Falcon, customer ACME-2024-001\n");

        Result result = run("distill", workspace.toString());

        Path document = workspace.toAbsolutePath().normalize().resolve(".mindprint/cognition.md");
        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out()).contains(document.toString()).contains("email=1", "customer_id=1", "name=1");
        assertThat(Files.readString(document))
            .contains("- Works with a collaborator on a project")
            .doesNotContain("Jane", "acme", "Falcon");
    }

    @Test
    void listShouldShowDistilledDocuments() throws Exception {
        Path workspace = Files.createDirectories(tempDir.resolve("ws"));
        Files.writeString(workspace.resolve("MEMORY.md"), "- Learns new tools by reading the documentation first\n");
        run("distill", workspace.toString());

        Result result = run("list", tempDir.toString());

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out()).contains("cognition.md", "bullets=1", "version=2.0");
    }

    @Test
    void shouldSyncRentPullAndRevoke() throws Exception {
        Path seller = Files.createDirectories(tempDir.resolve("seller"));
        Path buyer = Files.createDirectories(tempDir.resolve("buyer"));
        Files.writeString(seller.resolve("MEMORY.md"), "- Weighs trade-offs carefully before committing\n");

        Result sync = run("sync", "--workspace", seller.toString());
        assertThat(sync.code()).isEqualTo(0);
        assertThat(sync.out()).contains("Seller id: " + USER);

        Result rent = run("rent", USER, "--ttl-hours", "2");
        assertThat(rent.code()).isEqualTo(0);
        String token = rent.out().strip();
        assertThat(token).startsWith("mp@");

        Result pull = run("pull", token, "--workspace", buyer.toString());
        assertThat(pull.code()).isEqualTo(0);
        Path persona = buyer.toAbsolutePath().normalize()
            .resolve("personas").resolve(RentalService.personaId(USER)).resolve("cognition.md");
        assertThat(Files.readString(persona)).contains("- Weighs trade-offs carefully before committing");

        Result revoke = run("revoke", token);
        assertThat(revoke.code()).isEqualTo(0);
        assertThat(revoke.out()).contains("Rental revoked.");

        Result rejected = run("pull", token, "--workspace", buyer.toString());
        assertThat(rejected.code()).isEqualTo(1);
        assertThat(rejected.err().strip()).isEqualTo("Rental token is not valid.");
    }

    @Test
    void rentShouldFailForUnknownSeller() {
        Result result = run("rent", "nobody");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("No cognition profile is available for this seller.");
    }

    @Test
    void rentShouldRejectConflictingExpiryOptions() {
        Result result = run("rent", USER, "--ttl-hours", "1", "--no-expiry");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("cannot be combined");
    }

    @Test
    void onboardAndStatusShouldDescribeConfiguration() {
        Result onboard = run("onboard");
        Result status = run("status");

        assertThat(onboard.code()).isEqualTo(0);
        assertThat(onboard.out()).contains("Created config: " + tempDir.resolve("home/config.json"));
        assertThat(status.code()).isEqualTo(0);
        assertThat(status.out()).contains("Config exists: true", "Token namespace: mp", "Default rental TTL: 720h");
    }

    private Result run(String... args) {
        CommandLine commandLine = new CommandLine(new MindprintCliCommand());
        commandLine.addSubcommand("distill", new DistillCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("sync", new SyncCommand(context));
        commandLine.addSubcommand("pull", new PullCommand(context));
        commandLine.addSubcommand("rent", new RentCommand(context));
        commandLine.addSubcommand("revoke", new RevokeCommand(context));
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = commandLine.execute(args);
            return new Result(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Result(int code, String out, String err) {
    }
}
