package co.fanki.qualityhub.organization.domain;

import co.fanki.qualityhub.shared.Preconditions;
import co.fanki.qualityhub.shared.ValueObject;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Value object for the URL friendly, globally unique organization handle.
 *
 * <p>Slugs are lowercase, 2 to 100 characters long, and made of letters,
 * digits and single hyphens.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class OrganizationSlug implements ValueObject {

    private static final long serialVersionUID = 1L;

    private static final Pattern SLUG_PATTERN = Pattern.compile(
            "^[a-z0-9]+(?:-[a-z0-9]+)*$");

    private static final Pattern NON_SLUG_CHARS = Pattern.compile(
            "[^a-z0-9]+");

    private final String value;

    private OrganizationSlug(final String theValue) {
        Preconditions.requireLength(theValue, 2, 100, "Slug");
        Preconditions.require(SLUG_PATTERN.matcher(theValue).matches(),
                "Slug must contain only lowercase letters, numbers and"
                        + " hyphens: " + theValue);
        this.value = theValue;
    }

    /**
     * Creates a slug from an already formatted value.
     *
     * @param value the slug
     * @return the slug value object
     * @throws IllegalArgumentException if the value is not a valid slug
     */
    public static OrganizationSlug of(final String value) {
        return new OrganizationSlug(value);
    }

    /**
     * Derives a slug from a display name, e.g. "Acme QA Team" becomes
     * "acme-qa-team".
     *
     * @param name the organization name
     * @return the derived slug
     */
    public static OrganizationSlug fromName(final String name) {
        Preconditions.requireNonBlank(name, "Organization name is required");
        String slug = NON_SLUG_CHARS.matcher(
                name.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = slug.replaceAll("^-+", "").replaceAll("-+$", "");
        if (slug.length() > 100) {
            slug = slug.substring(0, 100).replaceAll("-+$", "");
        }
        if (slug.length() < 2) {
            slug = "org-" + slug;
        }
        return new OrganizationSlug(slug);
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
        final OrganizationSlug that = (OrganizationSlug) o;
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
