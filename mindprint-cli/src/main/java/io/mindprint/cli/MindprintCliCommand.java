package io.mindprint.cli;

import picocli.CommandLine.Command;

@Command(name = "mindprint", mixinStandardHelpOptions = true, description = "Distill, share and rent cognition profiles")
public final class MindprintCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
