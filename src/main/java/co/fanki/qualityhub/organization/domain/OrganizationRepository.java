package co.fanki.qualityhub.organization.domain;

import co.fanki.qualityhub.shared.JsonColumns;
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
 * Repository for persisting and retrieving organizations.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class OrganizationRepository {

    /** Find organization by ID. Uses: PK index. */
    public static final String FIND_BY_ID =
            "SELECT * FROM organizations WHERE id = :id";

    /** Find organization by slug. Uses: uq_organizations_slug. */
    public static final String FIND_BY_SLUG =
            "SELECT * FROM organizations WHERE slug = :slug";

    /** Find all organizations. Uses: seq scan (small table). */
    public static final String FIND_ALL =
            "SELECT * FROM organizations ORDER BY created_at DESC";

    /** Check if a slug is taken. Uses: uq_organizations_slug. */
    public static final String EXISTS_BY_SLUG =
            "SELECT COUNT(*) FROM organizations WHERE slug = :slug";

    private final Jdbi jdbi;

    /**
     * Creates a new OrganizationRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public OrganizationRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a new organization.
     *
     * @param organization the organization to save
     */
    public void save(final Organization organization) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO organizations (id, name, slug, plan, settings,
                    created_at)
                VALUES (:id, :name, :slug, :plan, CAST(:settings AS JSONB),
                    :createdAt)
                """)
                .bind("id", organization.id())
                .bind("name", organization.name())
                .bind("slug", organization.slug().value())
                .bind("plan", organization.plan().value())
                .bind("settings", JsonColumns.toJson(organization.settings()))
                .bind("createdAt", toTimestamp(organization.createdAt()))
                .execute());
    }

    /**
     * Updates an existing organization.
     *
     * @param organization the organization to update
     */
    public void update(final Organization organization) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE organizations SET
                    name = :name,
                    slug = :slug,
                    plan = :plan,
                    settings = CAST(:settings AS JSONB)
                WHERE id = :id
                """)
                .bind("id", organization.id())
                .bind("name", organization.name())
                .bind("slug", organization.slug().value())
                .bind("plan", organization.plan().value())
                .bind("settings", JsonColumns.toJson(organization.settings()))
                .execute());
    }

    /**
     * Finds an organization by its ID.
     *
     * @param id the organization ID
     * @return the organization if found
     */
    public Optional<Organization> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .map(new OrganizationRowMapper())
                .findOne());
    }

    /**
     * Finds an organization by its slug.
     *
     * @param slug the slug
     * @return the organization if found
     */
    public Optional<Organization> findBySlug(final OrganizationSlug slug) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_SLUG)
                .bind("slug", slug.value())
                .map(new OrganizationRowMapper())
                .findOne());
    }

    /**
     * Finds all organizations, newest first.
     *
     * @return list of all organizations
     */
    public List<Organization> findAll() {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_ALL)
                .map(new OrganizationRowMapper())
                .list());
    }

    /**
     * Checks whether a slug is already taken.
     *
     * @param slug the slug
     * @return true if an organization uses it
     */
    public boolean existsBySlug(final OrganizationSlug slug) {
        return jdbi.withHandle(handle -> handle
                .createQuery(EXISTS_BY_SLUG)
                .bind("slug", slug.value())
                .mapTo(Long.class)
                .one() > 0);
    }

    /**
     * Deletes an organization together with its users and projects.
     *
     * @param id the organization ID
     */
    public void delete(final String id) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM organizations WHERE id = :id")
                .bind("id", id)
                .execute());
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class OrganizationRowMapper
            implements RowMapper<Organization> {

        @Override
        public Organization map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Organization.reconstitute(
                    rs.getString("id"),
                    rs.getString("name"),
                    OrganizationSlug.of(rs.getString("slug")),
                    OrganizationPlan.fromValue(rs.getString("plan")),
                    JsonColumns.fromJson(rs.getString("settings"),
                            JsonColumns.OBJECT),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
