package co.fanki.qualityhub.requirement.domain;

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
 * Repository for requirements. Soft deleted requirements are never
 * returned or counted.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class RequirementRepository {

    /** Find a live requirement of a project. Uses: PK index. */
    public static final String FIND_BY_ID = """
            SELECT * FROM requirements
            WHERE id = :id AND project_id = :projectId
              AND deleted_at IS NULL
            """;

    /** Find live requirements of a project. Uses: idx_requirements_project_id. */
    public static final String FIND_BY_PROJECT = """
            SELECT * FROM requirements
            WHERE project_id = :projectId AND deleted_at IS NULL
            ORDER BY created_at
            """;

    /** Count live requirements of a project. Uses: idx_requirements_project_id. */
    public static final String COUNT_BY_PROJECT = """
            SELECT COUNT(*) FROM requirements
            WHERE project_id = :projectId AND deleted_at IS NULL
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new RequirementRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public RequirementRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final Requirement requirement) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO requirements (
                    id, project_id, external_id, title, description, source,
                    status, custom_fields, created_by, created_at, updated_at
                ) VALUES (
                    :id, :projectId, :externalId, :title, :description,
                    :source, :status, CAST(:customFields AS JSONB),
                    :createdBy, :createdAt, :updatedAt
                )
                """)
                .bind("id", requirement.id())
                .bind("projectId", requirement.projectId())
                .bind("externalId", requirement.externalId())
                .bind("title", requirement.title())
                .bind("description", requirement.description())
                .bind("source", requirement.source().value())
                .bind("status", requirement.status().value())
                .bind("customFields", JsonColumns.toJson(
                        requirement.customFields()))
                .bind("createdBy", requirement.createdBy())
                .bind("createdAt", toTimestamp(requirement.createdAt()))
                .bind("updatedAt", toTimestamp(requirement.updatedAt()))
                .execute());
    }

    public void update(final Requirement requirement) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE requirements SET
                    external_id = :externalId,
                    title = :title,
                    description = :description,
                    source = :source,
                    status = :status,
                    custom_fields = CAST(:customFields AS JSONB),
                    updated_at = :updatedAt
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", requirement.id())
                .bind("externalId", requirement.externalId())
                .bind("title", requirement.title())
                .bind("description", requirement.description())
                .bind("source", requirement.source().value())
                .bind("status", requirement.status().value())
                .bind("customFields", JsonColumns.toJson(
                        requirement.customFields()))
                .bind("updatedAt", toTimestamp(requirement.updatedAt()))
                .execute());
    }

    public Optional<Requirement> findById(final String projectId,
            final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .bind("projectId", projectId)
                .map(new RequirementRowMapper())
                .findOne());
    }

    public List<Requirement> findByProject(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PROJECT)
                .bind("projectId", projectId)
                .map(new RequirementRowMapper())
                .list());
    }

    public long countByProject(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(COUNT_BY_PROJECT)
                .bind("projectId", projectId)
                .mapTo(Long.class)
                .one());
    }

    /**
     * Soft deletes a requirement.
     *
     * @param id the requirement ID
     * @return true if a live requirement was deleted
     */
    public boolean softDelete(final String id) {
        return jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE requirements SET deleted_at = :now
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", id)
                .bind("now", toTimestamp(Instant.now()))
                .execute()) > 0;
    }

    private static Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class RequirementRowMapper
            implements RowMapper<Requirement> {

        @Override
        public Requirement map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return Requirement.reconstitute(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    rs.getString("external_id"),
                    rs.getString("title"),
                    rs.getString("description"),
                    RequirementSource.fromValue(rs.getString("source")),
                    RequirementStatus.fromValue(rs.getString("status")),
                    JsonColumns.fromJson(rs.getString("custom_fields"),
                            JsonColumns.OBJECT),
                    rs.getString("created_by"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant());
        }
    }

}
