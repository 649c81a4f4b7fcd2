package co.fanki.qualityhub.project.domain;

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
 * Repository for persisting and retrieving projects.
 *
 * <p>Soft deleted projects are invisible to every finder.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class ProjectRepository {

    /** Find live project by ID. Uses: PK index. */
    public static final String FIND_BY_ID = """
            SELECT * FROM projects
            WHERE id = :id AND deleted_at IS NULL
            """;

    /** Find live projects of an organization. Uses: idx_projects_org_id. */
    public static final String FIND_BY_ORGANIZATION = """
            SELECT * FROM projects
            WHERE org_id = :orgId AND deleted_at IS NULL
            ORDER BY created_at DESC
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new ProjectRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public ProjectRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Saves a new project.
     *
     * @param project the project to save
     */
    public void save(final Project project) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO projects (
                    id, org_id, name, description, settings,
                    created_at, updated_at
                ) VALUES (
                    :id, :orgId, :name, :description, CAST(:settings AS JSONB),
                    :createdAt, :updatedAt
                )
                """)
                .bind("id", project.id())
                .bind("orgId", project.organizationId())
                .bind("name", project.name())
                .bind("description", project.description())
                .bind("settings", JsonColumns.toJson(project.settings()))
                .bind("createdAt", toTimestamp(project.createdAt()))
                .bind("updatedAt", toTimestamp(project.updatedAt()))
                .execute());
    }

    /**
     * Updates an existing project.
     *
     * @param project the project to update
     */
    public void update(final Project project) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE projects SET
                    name = :name,
                    description = :description,
                    settings = CAST(:settings AS JSONB),
                    updated_at = :updatedAt
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", project.id())
                .bind("name", project.name())
                .bind("description", project.description())
                .bind("settings", JsonColumns.toJson(project.settings()))
                .bind("updatedAt", toTimestamp(project.updatedAt()))
                .execute());
    }

    /**
     * Finds a live project by its ID.
     *
     * @param id the project ID
     * @return the project if found and not deleted
     */
    public Optional<Project> findById(final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .map(new ProjectRowMapper())
                .findOne());
    }

    /**
     * Finds the live projects of an organization.
     *
     * @param organizationId the organization ID
     * @return the projects, newest first
     */
    public List<Project> findByOrganization(final String organizationId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ORGANIZATION)
                .bind("orgId", organizationId)
                .map(new ProjectRowMapper())
                .list());
    }

    /**
     * Soft deletes a project.
     *
     * @param id the project ID
     * @return true if a live project was deleted
     */
    public boolean softDelete(final String id) {
        return jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE projects SET deleted_at = :now
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", id)
                .bind("now", toTimestamp(Instant.now()))
                .execute()) > 0;
    }

    private Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class ProjectRowMapper implements RowMapper<Project> {

        @Override
        public Project map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final Timestamp deletedTs = rs.getTimestamp("deleted_at");
            return Project.reconstitute(
                    rs.getString("id"),
                    rs.getString("org_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    JsonColumns.fromJson(rs.getString("settings"),
                            JsonColumns.OBJECT),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant(),
                    deletedTs != null ? deletedTs.toInstant() : null);
        }
    }

}
