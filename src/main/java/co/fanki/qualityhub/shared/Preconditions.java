package co.fanki.qualityhub.shared;

/**
 * Utility class for argument validation and precondition checks.
 *
 * <p>Aggregates call these from their constructors and mutators, so an
 * invalid title or a negative position never reaches the database.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class, not instantiable
    }

    /**
     * Ensures that an object reference is not null.
     *
     * @param reference the object reference to check
     * @param message the exception message if null
     * @param <T> the type of the reference
     * @return the non-null reference
     * @throws IllegalArgumentException if reference is null
     */
    public static <T> T requireNonNull(final T reference, final String message) {
        if (reference == null) {
            throw new IllegalArgumentException(message);
        }
        return reference;
    }

    /**
     * Ensures that a string is not null or blank.
     *
     * @param value the string to check
     * @param message the exception message if null or blank
     * @return the non-blank string
     * @throws IllegalArgumentException if value is null or blank
     */
    public static String requireNonBlank(final String value,
            final String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    /**
     * Ensures that a string is not blank and its length falls in a range.
     *
     * @param value the string to check
     * @param min the minimum length, inclusive
     * @param max the maximum length, inclusive
     * @param field the field name used in the error message
     * @return the validated string
     * @throws IllegalArgumentException if the value is blank or out of range
     */
    public static String requireLength(final String value, final int min,
            final int max, final String field) {
        requireNonBlank(value, field + " is required");
        final int length = value.length();
        if (length < min || length > max) {
            throw new IllegalArgumentException(field + " must be between "
                    + min + " and " + max + " characters");
        }
        return value;
    }

    /**
     * Ensures that a condition is true.
     *
     * @param condition the condition to check
     * @param message the exception message if false
     * @throws IllegalArgumentException if condition is false
     */
    public static void require(final boolean condition, final String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Ensures that a number is non-negative.
     *
     * @param value the number to check
     * @param message the exception message if negative
     * @return the non-negative number
     * @throws IllegalArgumentException if value is negative
     */
    public static int requireNonNegative(final int value, final String message) {
        if (value < 0) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

}
