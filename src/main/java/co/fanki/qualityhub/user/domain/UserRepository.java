package co.fanki.qualityhub.user.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for persisting and retrieving users.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class UserRepository {

    /** Find user by ID. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM users WHERE id = :id";

    /** Find user by e-mail. Uses: uq_users_email. */
    public static final String FIND_BY_EMAIL =
            "SELECT * FROM users WHERE email = :email";

    /** Find users of an organization. Uses: idx_users_org_id. */
    public static final String FIND_BY_ORGANIZATION = """
            SELECT * FROM users
            WHERE org_id = :orgId
            ORDER BY created_at
            """;

    /** Check if an e-mail is registered. Uses: uq_users_email. */
    public static final String EXISTS_BY_EMAIL =
            "SELECT COUNT(*) FROM users WHERE email = :email";

    private final Jdbi jdbi;

    /**
     * Creates a new UserRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public UserRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a new user.
     *
     * @param user the user to save
     */
    public void save(final User user) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO users (id, org_id, email, password_hash, name,
                    role, created_at)
                VALUES (:id, :orgId, :email, :passwordHash, :name, :role,
                    :createdAt)
                """)
                .bind("id", user.id())
                .bind("orgId", user.organizationId())
                .bind("email", user.email().value())
                .bind("passwordHash", user.passwordHash())
                .bind("name", user.name())
                .bind("role", user.role().value())
                .bind("createdAt", toTimestamp(user.createdAt()))
                .execute());
    }

    /**
     * Updates name, role and password hash of an existing user.
     *
     * @param user the user to update
     */
    public void update(final User user) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE users SET
                    name = :name,
                    role = :role,
                    password_hash = :passwordHash
                WHERE id = :id
                """)
                .bind("id", user.id())
                .bind("name", user.name())
                .bind("role", user.role().value())
                .bind("passwordHash", user.passwordHash())
                .execute());
    }

    /**
     * Finds a user by ID.
     *
     * @param id the user ID
     * @return the user if found
     */
    public Optional<User> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .map(new UserRowMapper())
                .findOne());
    }

    /**
     * Finds a user by e-mail.
     *
     * @param email the e-mail
     * @return the user if found
     */
    public Optional<User> findByEmail(final Email email) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_EMAIL)
                .bind("email", email.value())
                .map(new UserRowMapper())
                .findOne());
    }

    /**
     * Finds the users of an organization, oldest first.
     *
     * @param organizationId the organization ID
     * @return the users
     */
    public List<User> findByOrganization(final String organizationId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ORGANIZATION)
                .bind("orgId", organizationId)
                .map(new UserRowMapper())
                .list());
    }

    /**
     * Checks whether an e-mail is already registered.
     *
     * @param email the e-mail
     * @return true if taken
     */
    public boolean existsByEmail(final Email email) {
        return jdbi.withHandle(handle -> handle
                .createQuery(EXISTS_BY_EMAIL)
                .bind("email", email.value())
                .mapTo(Long.class)
                .one() > 0);
    }

    /**
     * Deletes a user.
     *
     * @param id the user ID
     */
    public void delete(final String id) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM users WHERE id = :id")
                .bind("id", id)
                .execute());
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class UserRowMapper implements RowMapper<User> {

        @Override
        public User map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return User.reconstitute(
                    rs.getString("id"),
                    rs.getString("org_id"),
                    Email.of(rs.getString("email")),
                    rs.getString("password_hash"),
                    rs.getString("name"),
                    UserRole.fromValue(rs.getString("role")),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
