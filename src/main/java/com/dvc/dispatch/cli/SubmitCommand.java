package com.dvc.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: dvc submit &lt;session-id&gt; &lt;flag&gt;
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit a flag for a session")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Parameters(index = "1", description = "Flag, e.g. flag{0123456789abcdef}")
    private String flag;

    @Mixin
    private ServerOptions serverOptions;

    private final ApiClient apiClient;

    public SubmitCommand(ApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        try {
            var response = apiClient.post(serverOptions.server(), "/api/v1/flags",
                    Map.of("session_id", sessionId, "flag", flag));
            if (!response.ok()) {
                ConsoleOutput.error("Submission failed: " + response.errorMessage());
                return 1;
            }
            String message = response.body().path("message").asText();
            if (response.body().path("valid").asBoolean()) {
                ConsoleOutput.success(message);
                return 0;
            }
            ConsoleOutput.error(message);
            return 1;
        } catch (ApiClient.ApiException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
