package com.dvc.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * Shared {@code --server} option for commands that talk to a running engine.
 */
public class ServerOptions {

    @Option(names = {"--server", "-s"}, description = "Engine base URL (default: ${DEFAULT-VALUE})",
            defaultValue = "${DVC_SERVER:-http://localhost:8080}")
    String server;

    public String server() {
        return server;
    }
}
