package co.fanki.qualityhub.auth.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RefreshToken}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RefreshTokenTest {

    @Test
    void whenCheckingUsable_givenFreshToken_shouldBeUsable() {
        final RefreshToken token = RefreshToken.issue("user-1",
                Instant.now().plusSeconds(60));

        assertTrue(token.isUsable(Instant.now()));
    }

    @Test
    void whenCheckingUsable_givenExpiredToken_shouldNotBeUsable() {
        final RefreshToken token = RefreshToken.issue("user-1",
                Instant.now().plusSeconds(60));

        assertFalse(token.isUsable(Instant.now().plusSeconds(120)));
    }

    @Test
    void whenRevokingTwice_givenToken_shouldKeepFirstRevocation() {
        final RefreshToken token = RefreshToken.issue("user-1",
                Instant.now().plusSeconds(60));

        token.revoke();
        final Instant firstRevocation = token.revokedAt();
        token.revoke();

        assertEquals(firstRevocation, token.revokedAt());
        assertFalse(token.isUsable(Instant.now()));
    }

}
