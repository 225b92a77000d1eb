package com.di.pitnova.exception;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for validation error rows and API error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and optionally add a helper in the "Matcher helpers" section below.
 */
public enum ErrorCategory {

    INSUFFICIENT_DATA("Insufficient data", "Too few laps to fit a degradation model"),
    MODEL_NOT_FITTED("Model not fitted", "No usable degradation model for the requested track and compound"),
    INVALID_RACE_STATE("Invalid race state", "Decision-point inputs are outside the race or malformed"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    SERIALIZATION_ERROR("Serialization error", "Snapshot or result file could not be read or written"),
    RESOURCE_ERROR("Resource error", "File system or other resource unavailable"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof InsufficientDataException, INSUFFICIENT_DATA);
        MATCHERS.put(t -> t instanceof ModelNotFittedException, MODEL_NOT_FITTED);
        MATCHERS.put(t -> t instanceof InvalidRaceStateException, INVALID_RACE_STATE);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /**
     * Category name as stored in validation result files; inverse of {@link #name()}
     * that tolerates blanks and unknown values.
     */
    @JsonCreator
    public static ErrorCategory fromStoredName(String stored) {
        if (stored == null || stored.isBlank()) return null;
        for (ErrorCategory c : values()) {
            if (c.name().equals(stored.trim())) return c;
        }
        return UNKNOWN;
    }

    // --- Matcher helpers ---

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JacksonException
                || (t instanceof java.io.UncheckedIOException
                    && t.getCause() instanceof com.fasterxml.jackson.core.JacksonException);
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof java.io.IOException
                || t instanceof java.io.UncheckedIOException
                || t instanceof java.nio.file.FileSystemException;
    }

    @Override
    public String toString() {
        return name();
    }
}
