package co.fanki.qualityhub.plan.domain;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Repository for the entries of a test plan.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class TestPlanEntryRepository {

    /** Entries of a plan in order. Uses: uq_test_plan_entries_plan_case. */
    public static final String FIND_BY_PLAN = """
            SELECT * FROM test_plan_entries
            WHERE plan_id = :planId
            ORDER BY position, created_at
            """;

    /** Highest position in a plan, -1 when empty. */
    public static final String MAX_POSITION = """
            SELECT COALESCE(MAX(position), -1) FROM test_plan_entries
            WHERE plan_id = :planId
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new TestPlanEntryRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public TestPlanEntryRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final TestPlanEntry entry) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO test_plan_entries (
                    id, plan_id, case_id, position, created_at
                ) VALUES (
                    :id, :planId, :caseId, :position, :createdAt
                )
                """)
                .bind("id", entry.id())
                .bind("planId", entry.planId())
                .bind("caseId", entry.caseId())
                .bind("position", entry.position())
                .bind("createdAt", Timestamp.from(entry.createdAt()))
                .execute());
    }

    public void updatePosition(final TestPlanEntry entry) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE test_plan_entries SET position = :position
                WHERE id = :id
                """)
                .bind("id", entry.id())
                .bind("position", entry.position())
                .execute());
    }

    public List<TestPlanEntry> findByPlan(final String planId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_PLAN)
                .bind("planId", planId)
                .map(new EntryRowMapper())
                .list());
    }

    public Optional<TestPlanEntry> findById(final String planId,
            final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery("""
                        SELECT * FROM test_plan_entries
                        WHERE id = :id AND plan_id = :planId
                        """)
                .bind("id", id)
                .bind("planId", planId)
                .map(new EntryRowMapper())
                .findOne());
    }

    public boolean exists(final String planId, final String caseId) {
        return !caseIdsIn(planId, Set.of(caseId)).isEmpty();
    }

    /**
     * Returns which of the given cases are already in a plan.
     *
     * @param planId the plan ID
     * @param caseIds the candidate case IDs
     * @return the subset already present
     */
    public Set<String> caseIdsIn(final String planId,
            final Collection<String> caseIds) {
        if (caseIds.isEmpty()) {
            return Set.of();
        }
        return jdbi.withHandle(handle -> handle
                .createQuery("""
                        SELECT case_id FROM test_plan_entries
                        WHERE plan_id = :planId AND case_id IN (<caseIds>)
                        """)
                .bind("planId", planId)
                .bindList("caseIds", caseIds)
                .mapTo(String.class)
                .collect(Collectors.toCollection(
                        HashSet::new)));
    }

    public int maxPosition(final String planId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(MAX_POSITION)
                .bind("planId", planId)
                .mapTo(Integer.class)
                .one());
    }

    public void delete(final String id) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM test_plan_entries WHERE id = :id")
                .bind("id", id)
                .execute());
    }

    /**
     * Deletes several entries of a plan.
     *
     * @param planId the plan ID
     * @param ids the entry IDs
     * @return how many entries were deleted
     */
    public int deleteAll(final String planId, final Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return jdbi.withHandle(handle -> handle.createUpdate("""
                DELETE FROM test_plan_entries
                WHERE plan_id = :planId AND id IN (<ids>)
                """)
                .bind("planId", planId)
                .bindList("ids", ids)
                .execute());
    }

    private static final class EntryRowMapper
            implements RowMapper<TestPlanEntry> {

        @Override
        public TestPlanEntry map(final ResultSet rs,
                final StatementContext ctx) throws SQLException {
            return TestPlanEntry.reconstitute(
                    rs.getString("id"),
                    rs.getString("plan_id"),
                    rs.getString("case_id"),
                    rs.getInt("position"),
                    rs.getTimestamp("created_at").toInstant());
        }
    }

}
