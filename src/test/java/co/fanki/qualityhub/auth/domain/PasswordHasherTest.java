package co.fanki.qualityhub.auth.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PasswordHasher}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher(4);

    @Test
    void whenHashing_givenPassword_shouldMatchOnlyTheSamePassword() {
        final String hash = hasher.hash("s3cret-pass");

        assertNotEquals("s3cret-pass", hash);
        assertTrue(hasher.matches("s3cret-pass", hash));
        assertFalse(hasher.matches("other-pass", hash));
    }

    @Test
    void whenHashing_givenSamePasswordTwice_shouldSaltEachHash() {
        assertNotEquals(hasher.hash("s3cret-pass"), hasher.hash("s3cret-pass"));
    }

    @Test
    void whenMatching_givenNullHash_shouldReturnFalse() {
        assertFalse(hasher.matches("s3cret-pass", null));
    }

    @Test
    void whenHashing_givenBlankPassword_shouldThrowException() {
        assertThrows(IllegalArgumentException.class, () -> hasher.hash(" "));
    }

}
