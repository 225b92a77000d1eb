package com.di.pitnova.exception;

import com.di.pitnova.model.Compound;
import com.di.pitnova.model.DegradationKey;
import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory enum.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    private static final DegradationKey KEY = DegradationKey.of("bahrain", Compound.SOFT);

    static Stream<Arguments> categorizedExceptions() {
        return Stream.of(
                Arguments.of(new InsufficientDataException(KEY, 3, 5), ErrorCategory.INSUFFICIENT_DATA),
                Arguments.of(new ModelNotFittedException(KEY), ErrorCategory.MODEL_NOT_FITTED),
                Arguments.of(new InvalidRaceStateException("lap 55 > 50"), ErrorCategory.INVALID_RACE_STATE),
                Arguments.of(new IllegalArgumentException("bad"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new IllegalStateException("bad"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new UncheckedIOException(new IOException("disk")), ErrorCategory.RESOURCE_ERROR),
                Arguments.of(new UncheckedIOException(new JsonParseException(null, "broken")), ErrorCategory.SERIALIZATION_ERROR),
                Arguments.of(new RuntimeException("boom"), ErrorCategory.APPLICATION_ERROR));
    }

    @ParameterizedTest
    @MethodSource("categorizedExceptions")
    @DisplayName("Should categorize exceptions by type")
    void testCategorize(Throwable t, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(t));
    }

    @Test
    @DisplayName("Null exception is UNKNOWN")
    void testCategorize_Null() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    @Test
    @DisplayName("Stored names map back; blanks are null and unknown names UNKNOWN")
    void testFromStoredName() {
        assertEquals(ErrorCategory.MODEL_NOT_FITTED, ErrorCategory.fromStoredName("MODEL_NOT_FITTED"));
        assertNull(ErrorCategory.fromStoredName(""));
        assertNull(ErrorCategory.fromStoredName(null));
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.fromStoredName("SOMETHING_ELSE"));
    }

    @Test
    @DisplayName("Every category has a name and description")
    void testGetNameAndDescription() {
        for (ErrorCategory c : ErrorCategory.values()) {
            assertFalse(c.getName().isEmpty());
            assertFalse(c.getDescription().isEmpty());
        }
    }

    @Test
    @DisplayName("InsufficientDataException reports found and required counts")
    void insufficientDataMessage() {
        InsufficientDataException e = new InsufficientDataException(KEY, 3, 5);
        assertEquals(3, e.getFound());
        assertEquals(5, e.getRequired());
        assertEquals(KEY, e.getKey());
        assertTrue(e.getMessage().contains("bahrain/SOFT"));
    }
}
