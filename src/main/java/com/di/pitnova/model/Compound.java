package com.di.pitnova.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Dry-weather slick compounds. Intermediate and wet tyres are not modelled.
 */
public enum Compound {
    SOFT,
    MEDIUM,
    HARD;

    /**
     * Parses a compound name case-insensitively, ignoring surrounding whitespace.
     *
     * @throws IllegalArgumentException when the name is blank or not a slick compound
     */
    @JsonCreator
    public static Compound fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Compound cannot be null or empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Compound c : values()) {
            if (c.name().equals(normalized)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Compound must be one of SOFT, MEDIUM, HARD, got '" + name + "'");
    }
}
