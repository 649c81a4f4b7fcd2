package co.fanki.qualityhub.user.domain;

import co.fanki.qualityhub.shared.Preconditions;
import co.fanki.qualityhub.shared.ValueObject;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Value object for a login e-mail address, normalized to lowercase.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Email implements ValueObject {

    private static final long serialVersionUID = 1L;

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final String value;

    private Email(final String theValue) {
        Preconditions.requireNonBlank(theValue, "Email is required");
        final String normalized = theValue.trim().toLowerCase(Locale.ROOT);
        Preconditions.require(normalized.length() <= 255,
                "Email must be at most 255 characters");
        Preconditions.require(EMAIL_PATTERN.matcher(normalized).matches(),
                "Invalid email address: " + theValue);
        this.value = normalized;
    }

    /**
     * Creates an e-mail value object.
     *
     * @param value the address as typed by the user
     * @return the normalized e-mail
     * @throws IllegalArgumentException if the address is malformed
     */
    public static Email of(final String value) {
        return new Email(value);
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Email that = (Email) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }

}
