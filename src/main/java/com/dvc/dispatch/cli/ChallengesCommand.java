package com.dvc.dispatch.cli;

import com.dvc.core.catalog.ChallengeCatalog;
import com.dvc.core.model.ChallengeDefinition;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: dvc challenges
 * <p>
 * Lists the local challenge catalog; no server needed.
 */
@Command(name = "challenges", mixinStandardHelpOptions = true, description = "List available challenges")
@Component
public class ChallengesCommand implements Runnable {

    @Option(names = {"--category", "-c"}, description = "Only show this category")
    private String category;

    private final ChallengeCatalog catalog;

    public ChallengesCommand(ChallengeCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<ChallengeDefinition> challenges = catalog.list().stream()
                .filter(c -> category == null || c.category().equalsIgnoreCase(category))
                .toList();
        if (challenges.isEmpty()) {
            ConsoleOutput.info("No challenges found");
            return;
        }
        for (ChallengeDefinition c : challenges) {
            ConsoleOutput.challenge(c.id(), c.name(), c.category(), c.difficulty().jsonValue(), c.points());
        }
        System.out.println();
        ConsoleOutput.info(challenges.size() + " challenge(s)");
    }
}
