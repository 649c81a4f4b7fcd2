package co.fanki.qualityhub.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "test";

        final String result = Preconditions.requireNonNull(value, "message");

        assertEquals(value, result);
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequireNonBlank_givenNullString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank(null, "String is null"));
    }

    @Test
    void whenRequireLength_givenValueInRange_shouldReturnValue() {
        assertEquals("abc",
                Preconditions.requireLength("abc", 3, 500, "Title"));
    }

    @Test
    void whenRequireLength_givenTooShortValue_shouldNameFieldAndBounds() {
        final IllegalArgumentException error = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.requireLength("ab", 3, 500, "Title"));

        assertEquals("Title must be between 3 and 500 characters",
                error.getMessage());
    }

    @Test
    void whenRequireLength_givenBlankValue_shouldReportRequired() {
        final IllegalArgumentException error = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.requireLength(" ", 1, 10, "Name"));

        assertEquals("Name is required", error.getMessage());
    }

    @Test
    void whenRequire_givenTrueCondition_shouldNotThrow() {
        Preconditions.require(true, "Should not throw");
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));
    }

    @Test
    void whenRequireNonNegative_givenZero_shouldReturnZero() {
        final int result = Preconditions.requireNonNegative(0, "message");

        assertEquals(0, result);
    }

    @Test
    void whenRequireNonNegative_givenNegative_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNegative(-1, "Negative"));
    }

}
