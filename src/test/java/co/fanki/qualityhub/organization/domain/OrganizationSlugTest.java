package co.fanki.qualityhub.organization.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link OrganizationSlug}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class OrganizationSlugTest {

    @Test
    void whenDerivingFromName_givenWordsAndSpaces_shouldHyphenate() {
        assertEquals("acme-qa-team",
                OrganizationSlug.fromName("Acme QA Team").value());
    }

    @Test
    void whenDerivingFromName_givenPunctuation_shouldCollapseSeparators() {
        assertEquals("acme-co",
                OrganizationSlug.fromName("  ACME, Co.!  ").value());
    }

    @Test
    void whenDerivingFromName_givenSingleCharacter_shouldPrefix() {
        assertEquals("org-x", OrganizationSlug.fromName("X").value());
    }

    @Test
    void whenDerivingFromName_givenVeryLongName_shouldTruncate() {
        final OrganizationSlug slug = OrganizationSlug.fromName(
                "a".repeat(150));

        assertEquals(100, slug.value().length());
    }

    @Test
    void whenCreating_givenUppercase_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> OrganizationSlug.of("Acme"));
    }

    @Test
    void whenCreating_givenTrailingHyphen_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> OrganizationSlug.of("acme-"));
    }

    @Test
    void whenComparing_givenSameValue_shouldBeEqual() {
        assertEquals(OrganizationSlug.of("acme"), OrganizationSlug.of("acme"));
    }

}
