package com.dvc.dispatch.cli;

import com.dvc.DvcApplication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree with Spring-built commands and hands its
 * exit code back to Spring Boot.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final DvcCommand dvcCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(DvcCommand dvcCommand, IFactory factory) {
        this.dvcCommand = dvcCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (DvcApplication.isServeMode(args)) {
            // the web server owns the process; ServeCommand prints the banner once it is up
            return;
        }
        exitCode = new CommandLine(dvcCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
