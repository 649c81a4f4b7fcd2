package co.fanki.qualityhub.auth.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * Server side record of an issued refresh token.
 *
 * <p>The token itself is a signed JWT whose {@code jti} claim is this
 * record's ID. Revoking the record invalidates the JWT even while its
 * signature and expiry are still valid.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RefreshToken {

    private final String id;
    private final String userId;
    private final Instant expiresAt;
    private Instant revokedAt;
    private final Instant createdAt;

    private RefreshToken(final String theId, final String theUserId,
            final Instant theExpiresAt, final Instant theRevokedAt,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Refresh token ID is required");
        this.userId = Preconditions.requireNonBlank(theUserId,
                "User ID is required");
        this.expiresAt = Preconditions.requireNonNull(theExpiresAt,
                "Expiration is required");
        this.revokedAt = theRevokedAt;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    /**
     * Issues a new refresh token record.
     *
     * @param userId the owner
     * @param expiresAt when the token stops being valid
     * @return a new RefreshToken
     */
    public static RefreshToken issue(final String userId,
            final Instant expiresAt) {
        return new RefreshToken(UUID.randomUUID().toString(), userId,
                expiresAt, null, Instant.now());
    }

    /**
     * Reconstitutes a refresh token from persistence.
     *
     * @param id the token ID
     * @param userId the owner
     * @param expiresAt the expiration
     * @param revokedAt when revoked, may be null
     * @param createdAt when issued
     * @return the reconstituted RefreshToken
     */
    public static RefreshToken reconstitute(final String id,
            final String userId, final Instant expiresAt,
            final Instant revokedAt, final Instant createdAt) {
        return new RefreshToken(id, userId, expiresAt, revokedAt, createdAt);
    }

    /**
     * Whether this token can still be exchanged for a new pair.
     *
     * @param now the current instant
     * @return true if not revoked and not expired
     */
    public boolean isUsable(final Instant now) {
        return revokedAt == null && now.isBefore(expiresAt);
    }

    /** Marks the token as revoked, keeping the first revocation time. */
    public void revoke() {
        if (revokedAt == null) {
            revokedAt = Instant.now();
        }
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public Instant revokedAt() {
        return revokedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
