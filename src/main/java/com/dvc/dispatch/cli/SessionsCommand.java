package com.dvc.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: dvc sessions [session-id]
 * <p>
 * Lists active sessions, or shows one session (including terminal ones).
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List active sessions or show one")
@Component
public class SessionsCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Session ID")
    private String sessionId;

    @Mixin
    private ServerOptions serverOptions;

    private final ApiClient apiClient;

    public SessionsCommand(ApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        String path = sessionId == null ? "/api/v1/sessions" : "/api/v1/sessions/" + sessionId;
        try {
            var response = apiClient.get(serverOptions.server(), path);
            if (!response.ok()) {
                ConsoleOutput.error(response.errorMessage());
                return 1;
            }
            JsonNode body = response.body();
            if (!body.isArray()) {
                ConsoleOutput.session(body);
                return 0;
            }
            if (body.isEmpty()) {
                ConsoleOutput.info("No active sessions");
                return 0;
            }
            for (JsonNode session : body) {
                ConsoleOutput.session(session);
            }
            ConsoleOutput.info(body.size() + " active session(s)");
            return 0;
        } catch (ApiClient.ApiException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
