package co.fanki.qualityhub.milestone.domain;

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
 * Repository for milestones. Soft deleted milestones are never returned.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class MilestoneRepository {

    /** Find a live milestone of a project. Uses: PK index. */
    public static final String FIND_BY_ID = """
            SELECT * FROM milestones
            WHERE id = :id AND project_id = :projectId
              AND deleted_at IS NULL
            """;

    /** Find live milestones of a project. Uses: idx_milestones_project_completed. */
    public static final String FIND_BY_PROJECT = """
            SELECT * FROM milestones
            WHERE project_id = :projectId AND deleted_at IS NULL
            ORDER BY created_at
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new MilestoneRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public MilestoneRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final Milestone milestone) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO milestones (
                    id, project_id, name, description, due_date, is_completed,
                    created_at, updated_at
                ) VALUES (
                    :id, :projectId, :name, :description, :dueDate,
                    :completed, :createdAt, :updatedAt
                )
                """)
                .bind("id", milestone.id())
                .bind("projectId", milestone.projectId())
                .bind("name", milestone.name())
                .bind("description", milestone.description())
                .bind("dueDate", toTimestamp(milestone.dueDate()))
                .bind("completed", milestone.isCompleted())
                .bind("createdAt", toTimestamp(milestone.createdAt()))
                .bind("updatedAt", toTimestamp(milestone.updatedAt()))
                .execute());
    }

    public void update(final Milestone milestone) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE milestones SET
                    name = :name,
                    description = :description,
                    due_date = :dueDate,
                    is_completed = :completed,
                    updated_at = :updatedAt
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", milestone.id())
                .bind("name", milestone.name())
                .bind("description", milestone.description())
                .bind("dueDate", toTimestamp(milestone.dueDate()))
                .bind("completed", milestone.isCompleted())
                .bind("updatedAt", toTimestamp(milestone.updatedAt()))
                .execute());
    }

    public Optional<Milestone> findById(final String projectId,
            final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .bind("projectId", projectId)
                .map(new MilestoneRowMapper())
                .findOne());
    }

    public List<Milestone> findByProject(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PROJECT)
                .bind("projectId", projectId)
                .map(new MilestoneRowMapper())
                .list());
    }

    /**
     * Soft deletes a milestone.
     *
     * @param id the milestone ID
     * @return true if a live milestone was deleted
     */
    public boolean softDelete(final String id) {
        return jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE milestones SET deleted_at = :now
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", id)
                .bind("now", toTimestamp(Instant.now()))
                .execute()) > 0;
    }

    private static Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class MilestoneRowMapper
            implements RowMapper<Milestone> {

        @Override
        public Milestone map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final Timestamp dueTs = rs.getTimestamp("due_date");
            return Milestone.reconstitute(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    dueTs != null ? dueTs.toInstant() : null,
                    rs.getBoolean("is_completed"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant());
        }
    }

}
