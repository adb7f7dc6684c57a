package com.dvc.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 */
@Command(
        name = "dvc",
        mixinStandardHelpOptions = true,
        version = "DVC engine 0.1.0",
        description = "Spawn, attack and verify intentionally vulnerable challenge containers",
        subcommands = {
                ServeCommand.class,
                ChallengesCommand.class,
                SpawnCommand.class,
                StopCommand.class,
                SubmitCommand.class,
                SessionsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DvcCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
