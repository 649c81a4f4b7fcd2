package co.fanki.qualityhub.run.domain;

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
 * Repository for test runs. Soft deleted runs are never returned.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class TestRunRepository {

    /** Find a live run of a project. Uses: PK index. */
    public static final String FIND_BY_ID = """
            SELECT * FROM test_runs
            WHERE id = :id AND project_id = :projectId
              AND deleted_at IS NULL
            """;

    /** Find live runs of a project. Uses: idx_test_runs_project_id. */
    public static final String FIND_BY_PROJECT = """
            SELECT * FROM test_runs
            WHERE project_id = :projectId AND deleted_at IS NULL
            ORDER BY created_at
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new TestRunRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public TestRunRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final TestRun run) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO test_runs (
                    id, project_id, plan_id, name, description, status,
                    config, assignee_id, started_at, completed_at,
                    created_at, updated_at
                ) VALUES (
                    :id, :projectId, :planId, :name, :description, :status,
                    CAST(:config AS JSONB), :assigneeId, :startedAt,
                    :completedAt, :createdAt, :updatedAt
                )
                """)
                .bind("id", run.id())
                .bind("projectId", run.projectId())
                .bind("planId", run.planId())
                .bind("name", run.name())
                .bind("description", run.description())
                .bind("status", run.status().value())
                .bind("config", JsonColumns.toJson(run.config()))
                .bind("assigneeId", run.assigneeId())
                .bind("startedAt", toTimestamp(run.startedAt()))
                .bind("completedAt", toTimestamp(run.completedAt()))
                .bind("createdAt", toTimestamp(run.createdAt()))
                .bind("updatedAt", toTimestamp(run.updatedAt()))
                .execute());
    }

    public void update(final TestRun run) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE test_runs SET
                    name = :name,
                    description = :description,
                    status = :status,
                    config = CAST(:config AS JSONB),
                    assignee_id = :assigneeId,
                    started_at = :startedAt,
                    completed_at = :completedAt,
                    updated_at = :updatedAt
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", run.id())
                .bind("name", run.name())
                .bind("description", run.description())
                .bind("status", run.status().value())
                .bind("config", JsonColumns.toJson(run.config()))
                .bind("assigneeId", run.assigneeId())
                .bind("startedAt", toTimestamp(run.startedAt()))
                .bind("completedAt", toTimestamp(run.completedAt()))
                .bind("updatedAt", toTimestamp(run.updatedAt()))
                .execute());
    }

    public Optional<TestRun> findById(final String projectId,
            final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .bind("projectId", projectId)
                .map(new TestRunRowMapper())
                .findOne());
    }

    public List<TestRun> findByProject(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PROJECT)
                .bind("projectId", projectId)
                .map(new TestRunRowMapper())
                .list());
    }

    /**
     * Soft deletes a run.
     *
     * @param id the run ID
     * @return true if a live run was deleted
     */
    public boolean softDelete(final String id) {
        return jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE test_runs SET deleted_at = :now
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", id)
                .bind("now", toTimestamp(Instant.now()))
                .execute()) > 0;
    }

    private static Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(final Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static final class TestRunRowMapper
            implements RowMapper<TestRun> {

        @Override
        public TestRun map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return TestRun.reconstitute(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    rs.getString("plan_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    TestRunStatus.fromValue(rs.getString("status")),
                    JsonColumns.fromJson(rs.getString("config"),
                            JsonColumns.OBJECT),
                    rs.getString("assignee_id"),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant());
        }
    }

}
