package co.fanki.qualityhub.auth.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Repository for refresh token records.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class RefreshTokenRepository {

    /** Find a token by ID. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM refresh_tokens WHERE id = :id";

    private final Jdbi jdbi;

    /**
     * Creates a new RefreshTokenRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public RefreshTokenRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a newly issued token.
     *
     * @param token the token
     */
    public void save(final RefreshToken token) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO refresh_tokens (id, user_id, expires_at,
                    revoked_at, created_at)
                VALUES (:id, :userId, :expiresAt, :revokedAt, :createdAt)
                """)
                .bind("id", token.id())
                .bind("userId", token.userId())
                .bind("expiresAt", toTimestamp(token.expiresAt()))
                .bind("revokedAt", toTimestamp(token.revokedAt()))
                .bind("createdAt", toTimestamp(token.createdAt()))
                .execute());
    }

    /**
     * Finds a token by ID, revoked or not.
     *
     * @param id the token ID
     * @return the token if found
     */
    public Optional<RefreshToken> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .map(new RefreshTokenRowMapper())
                .findOne());
    }

    /**
     * Revokes a single token.
     *
     * @param id the token ID
     * @return true if a live token was revoked
     */
    public boolean revoke(final String id) {
        return jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE refresh_tokens SET revoked_at = :now
                WHERE id = :id AND revoked_at IS NULL
                """)
                .bind("id", id)
                .bind("now", toTimestamp(Instant.now()))
                .execute()) > 0;
    }

    /**
     * Revokes every live token of a user.
     *
     * @param userId the user ID
     * @return the number of revoked tokens
     */
    public int revokeAllForUser(final String userId) {
        return jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE refresh_tokens SET revoked_at = :now
                WHERE user_id = :userId AND revoked_at IS NULL
                """)
                .bind("userId", userId)
                .bind("now", toTimestamp(Instant.now()))
                .execute());
    }

    /**
     * Deletes tokens that expired before the given instant.
     *
     * @param before the cut-off
     * @return the number of deleted rows
     */
    public int deleteExpired(final Instant before) {
        return jdbi.withHandle(handle -> handle
                .createUpdate(
                        "DELETE FROM refresh_tokens WHERE expires_at < :before")
                .bind("before", toTimestamp(before))
                .execute());
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class RefreshTokenRowMapper
            implements RowMapper<RefreshToken> {

        @Override
        public RefreshToken map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final Timestamp revokedTs = rs.getTimestamp("revoked_at");
            return RefreshToken.reconstitute(
                    rs.getString("id"),
                    rs.getString("user_id"),
                    rs.getTimestamp("expires_at").toInstant(),
                    revokedTs != null ? revokedTs.toInstant() : null,
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
