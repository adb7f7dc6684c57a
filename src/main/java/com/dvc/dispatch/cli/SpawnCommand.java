package com.dvc.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: dvc spawn &lt;challenge-id&gt;
 */
@Command(name = "spawn", mixinStandardHelpOptions = true, description = "Start a challenge container")
@Component
public class SpawnCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Challenge ID")
    private String challengeId;

    @Option(names = {"--user", "-u"}, description = "User ID (default: ${DEFAULT-VALUE})",
            defaultValue = "${USER:-player}")
    private String userId;

    @Option(names = {"--timeout", "-t"}, description = "Session lifetime in seconds")
    private Integer timeoutSeconds;

    @Option(names = "--wait", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Wait until the container is running; --no-wait returns at once")
    private boolean wait;

    @Mixin
    private ServerOptions serverOptions;

    private final ApiClient apiClient;

    public SpawnCommand(ApiClient apiClient) {
        this.apiClient = apiClient;
    }

    @Override
    public Integer call() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("challenge_id", challengeId);
        body.put("user_id", userId);
        if (timeoutSeconds != null) {
            body.put("timeout_seconds", timeoutSeconds);
        }
        try {
            var response = apiClient.post(serverOptions.server(), "/api/v1/sessions?wait=" + wait, body);
            if (!response.ok()) {
                ConsoleOutput.error("Spawn failed: " + response.errorMessage());
                return 1;
            }
            ConsoleOutput.success("Session " + response.body().path("session_id").asText() + " created");
            ConsoleOutput.session(response.body());
            return 0;
        } catch (ApiClient.ApiException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
