package co.fanki.qualityhub.plan.domain;

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
 * Repository for test plans. Soft deleted plans are never returned.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class TestPlanRepository {

    /** Find a live plan of a project. Uses: PK index. */
    public static final String FIND_BY_ID = """
            SELECT * FROM test_plans
            WHERE id = :id AND project_id = :projectId
              AND deleted_at IS NULL
            """;

    /** Find live plans of a project. Uses: idx_test_plans_project_id. */
    public static final String FIND_BY_PROJECT = """
            SELECT * FROM test_plans
            WHERE project_id = :projectId AND deleted_at IS NULL
            ORDER BY created_at
            """;

    /** Find live plans of a milestone. Uses: idx_test_plans_milestone_id. */
    public static final String FIND_BY_MILESTONE = """
            SELECT * FROM test_plans
            WHERE milestone_id = :milestoneId AND deleted_at IS NULL
            ORDER BY created_at
            """;

    /** Count live plans of a milestone. Uses: idx_test_plans_milestone_id. */
    public static final String COUNT_BY_MILESTONE = """
            SELECT COUNT(*) FROM test_plans
            WHERE milestone_id = :milestoneId AND deleted_at IS NULL
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new TestPlanRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public TestPlanRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final TestPlan plan) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO test_plans (
                    id, project_id, milestone_id, name, description,
                    created_at, updated_at
                ) VALUES (
                    :id, :projectId, :milestoneId, :name, :description,
                    :createdAt, :updatedAt
                )
                """)
                .bind("id", plan.id())
                .bind("projectId", plan.projectId())
                .bind("milestoneId", plan.milestoneId())
                .bind("name", plan.name())
                .bind("description", plan.description())
                .bind("createdAt", toTimestamp(plan.createdAt()))
                .bind("updatedAt", toTimestamp(plan.updatedAt()))
                .execute());
    }

    public void update(final TestPlan plan) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE test_plans SET
                    milestone_id = :milestoneId,
                    name = :name,
                    description = :description,
                    updated_at = :updatedAt
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", plan.id())
                .bind("milestoneId", plan.milestoneId())
                .bind("name", plan.name())
                .bind("description", plan.description())
                .bind("updatedAt", toTimestamp(plan.updatedAt()))
                .execute());
    }

    public Optional<TestPlan> findById(final String projectId,
            final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_ID)
                .bind("id", id)
                .bind("projectId", projectId)
                .map(new TestPlanRowMapper())
                .findOne());
    }

    public List<TestPlan> findByProject(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PROJECT)
                .bind("projectId", projectId)
                .map(new TestPlanRowMapper())
                .list());
    }

    public List<TestPlan> findByMilestone(final String milestoneId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_MILESTONE)
                .bind("milestoneId", milestoneId)
                .map(new TestPlanRowMapper())
                .list());
    }

    public long countByMilestone(final String milestoneId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(COUNT_BY_MILESTONE)
                .bind("milestoneId", milestoneId)
                .mapTo(Long.class)
                .one());
    }

    /**
     * Soft deletes a plan.
     *
     * @param id the plan ID
     * @return true if a live plan was deleted
     */
    public boolean softDelete(final String id) {
        return jdbi.withHandle(handle -> handle.createUpdate("""
                UPDATE test_plans SET deleted_at = :now
                WHERE id = :id AND deleted_at IS NULL
                """)
                .bind("id", id)
                .bind("now", toTimestamp(Instant.now()))
                .execute()) > 0;
    }

    private static Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class TestPlanRowMapper
            implements RowMapper<TestPlan> {

        @Override
        public TestPlan map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            return TestPlan.reconstitute(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    rs.getString("milestone_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant());
        }
    }

}
