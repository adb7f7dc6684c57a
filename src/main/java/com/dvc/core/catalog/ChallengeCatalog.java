package com.dvc.core.catalog;

import com.dvc.core.model.ChallengeDefinition;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of challenge definitions, keyed by id.
 */
public class ChallengeCatalog {

    /** Listing order: category, then difficulty tier, then name. */
    public static final Comparator<ChallengeDefinition> LISTING_ORDER =
            Comparator.comparing(ChallengeDefinition::category)
                    .thenComparing(ChallengeDefinition::difficulty)
                    .thenComparing(ChallengeDefinition::name);

    private final Map<String, ChallengeDefinition> challenges;
    private final String source;

    public ChallengeCatalog(List<ChallengeDefinition> definitions, String source) {
        Map<String, ChallengeDefinition> byId = new LinkedHashMap<>();
        for (ChallengeDefinition definition : definitions) {
            validate(definition);
            if (byId.putIfAbsent(definition.id(), definition) != null) {
                throw new CatalogException("Duplicate challenge id '" + definition.id() + "' in " + source);
            }
        }
        this.challenges = Collections.unmodifiableMap(byId);
        this.source = source;
    }

    public Optional<ChallengeDefinition> find(String challengeId) {
        return Optional.ofNullable(challenges.get(challengeId));
    }

    public boolean contains(String challengeId) {
        return challenges.containsKey(challengeId);
    }

    /**
     * All challenges in listing order.
     */
    public List<ChallengeDefinition> list() {
        return challenges.values().stream().sorted(LISTING_ORDER).toList();
    }

    public int size() {
        return challenges.size();
    }

    public String source() {
        return source;
    }

    private static void validate(ChallengeDefinition definition) {
        if (definition.id() == null || definition.id().isBlank()) {
            throw new CatalogException("Challenge without id: " + definition.name());
        }
        if (!definition.id().matches("[a-zA-Z0-9][a-zA-Z0-9_.-]*")) {
            throw new CatalogException("Challenge id '" + definition.id()
                    + "' may only contain letters, digits, '.', '_' and '-'");
        }
        if (definition.containerSpec() == null
                || definition.containerSpec().image() == null
                || definition.containerSpec().image().isBlank()) {
            throw new CatalogException("Challenge '" + definition.id() + "' has no container image");
        }
    }
}
