package io.mindprint.app;

import io.mindprint.cli.CliContext;
import io.mindprint.cli.DistillCommand;
import io.mindprint.cli.ListCommand;
import io.mindprint.cli.MindprintCliCommand;
import io.mindprint.cli.OnboardCommand;
import io.mindprint.cli.PullCommand;
import io.mindprint.cli.RentCommand;
import io.mindprint.cli.RevokeCommand;
import io.mindprint.cli.StatusCommand;
import io.mindprint.cli.SyncCommand;
import io.mindprint.core.config.ConfigPaths;
import io.mindprint.core.config.ConfigService;
import picocli.CommandLine;

public final class MindprintApplication {

    private MindprintApplication() {
    }

    public static void main(String[] args) {
        System.exit(commandLine(new CliContext(new ConfigService(), ConfigPaths.defaultConfigPath())).execute(args));
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new MindprintCliCommand());
        commandLine.addSubcommand("distill", new DistillCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("sync", new SyncCommand(context));
        commandLine.addSubcommand("pull", new PullCommand(context));
        commandLine.addSubcommand("rent", new RentCommand(context));
        commandLine.addSubcommand("revoke", new RevokeCommand(context));
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        return commandLine;
    }
}
