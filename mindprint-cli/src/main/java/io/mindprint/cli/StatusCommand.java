package io.mindprint.cli;

import io.mindprint.core.config.ConfigPaths;
import io.mindprint.core.config.model.MindprintConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and store status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MindprintConfig config = context.loadConfig();
            Path storePath = ConfigPaths.resolve(config.store().path());
            Long ttl = config.rental().defaultTtlHours();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("User id: " + (config.userId().isBlank() ? "(hardware-derived)" : config.userId()));
            System.out.println("Persona store: " + storePath);
            System.out.println("Persona store exists: " + Files.exists(storePath));
            System.out.println("Token namespace: " + config.rental().namespace());
            System.out.println("Default rental TTL: " + (ttl == null ? "never expires" : ttl + "h"));
            System.out.println("Output directory: " + config.distill().outputDirName());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
