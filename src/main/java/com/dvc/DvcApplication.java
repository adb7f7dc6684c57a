package com.dvc;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

/**
 * Entry point. {@code dvc serve} runs the engine behind the REST API; every
 * other command is a one-shot CLI run without a web server.
 */
@SpringBootApplication
public class DvcApplication {

    public static void main(String[] args) {
        boolean serveMode = isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(DvcApplication.class)
                .properties("spring.main.banner-mode=off");
        if (serveMode) {
            builder.properties("spring.main.web-application-type=servlet");
        } else {
            // CLI run: no web server, and the Docker client and executors are
            // only built if the chosen command needs them
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.lazy-initialization=true"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
            System.exit(exitCode);
        }
    }

    /**
     * True when the subcommand, the first argument that is not an option, is
     * {@code serve}. {@code dvc spawn serve} spawns a challenge named "serve".
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }
}
