package com.dvc.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: dvc stop &lt;session-id&gt;
 */
@Command(name = "stop", mixinStandardHelpOptions = true, description = "Stop a session and remove its container")
@Component
public class StopCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Mixin
    private ServerOptions serverOptions;

    private final ApiClient apiClient;

    public StopCommand(ApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        try {
            var response = apiClient.delete(serverOptions.server(), "/api/v1/sessions/" + sessionId);
            if (!response.ok()) {
                ConsoleOutput.error("Stop failed: " + response.errorMessage());
                return 1;
            }
            String message = response.body().path("message").asText();
            if (response.body().path("success").asBoolean()) {
                ConsoleOutput.success(message);
            } else {
                ConsoleOutput.warn(message);
            }
            return 0;
        } catch (ApiClient.ApiException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
