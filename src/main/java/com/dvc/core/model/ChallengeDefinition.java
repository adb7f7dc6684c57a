package com.dvc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * A catalog entry describing one vulnerable container scenario.
 * Loaded once at startup and never mutated.
 *
 * @param id            unique within the catalog
 * @param hints         ordered hints, carried for the hint collaborator only
 * @param estimatedTime free-form estimate such as "30 minutes"
 */
public record ChallengeDefinition(
    String id,
    String name,
    Difficulty difficulty,
    String category,
    int points,
    Set<String> tags,
    @JsonProperty("container_spec") ContainerSpec containerSpec,
    List<String> hints,
    @JsonProperty("estimated_time") String estimatedTime,
    String description
) {

    public ChallengeDefinition {
        tags = tags != null ? Set.copyOf(tags) : Set.of();
        hints = hints != null ? List.copyOf(hints) : List.of();
        name = name != null ? name : id;
        category = category != null ? category : "unknown";
        difficulty = difficulty != null ? difficulty : Difficulty.BEGINNER;
        description = description != null ? description : "";
    }
}
