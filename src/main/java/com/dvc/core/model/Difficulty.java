package com.dvc.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Difficulty tier of a catalog challenge. Ordinal order is the sort order.
 */
public enum Difficulty {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED,
    EXPERT;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Difficulty fromJson(String value) {
        return Difficulty.valueOf(value.trim().toUpperCase());
    }
}
