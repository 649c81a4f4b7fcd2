package co.fanki.qualityhub.auth.domain;

import co.fanki.qualityhub.shared.Preconditions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Salted bcrypt hashing of user passwords.
 *
 * <p>Every call to {@link #hash(String)} draws a fresh salt, so hashing the
 * same password twice yields two different strings that both verify.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class PasswordHasher {

    private final BCryptPasswordEncoder encoder;

    /**
     * Creates a new PasswordHasher.
     *
     * @param strength the bcrypt cost factor, between 4 and 31
     */
    public PasswordHasher(
            @Value("${auth.bcrypt-strength:10}") final int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    /**
     * Hashes a plain text password.
     *
     * @param plainPassword the password, never blank
     * @return the bcrypt hash
     */
    public String hash(final String plainPassword) {
        Preconditions.requireNonBlank(plainPassword, "Password is required");
        return encoder.encode(plainPassword);
    }

    /**
     * Verifies a password against a stored hash.
     *
     * @param plainPassword the candidate password
     * @param passwordHash the stored hash
     * @return true if they match
     */
    public boolean matches(final String plainPassword,
            final String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }
        return encoder.matches(plainPassword, passwordHash);
    }

}
