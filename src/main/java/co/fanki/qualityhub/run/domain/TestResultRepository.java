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
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Repository for the results of test runs.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class TestResultRepository {

    /** Results of a run in insertion order. Uses: uq_test_results_run_case. */
    public static final String FIND_BY_RUN = """
            SELECT * FROM test_results
            WHERE run_id = :runId
            ORDER BY created_at
            """;

    /** Result count per status of a run. Uses: idx_test_results_run_status. */
    public static final String COUNT_BY_STATUS = """
            SELECT status, COUNT(*) AS total FROM test_results
            WHERE run_id = :runId
            GROUP BY status
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new TestResultRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public TestResultRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public void save(final TestResult result) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                INSERT INTO test_results (
                    id, run_id, case_id, case_version, status, comment,
                    elapsed, defects, executed_by, executed_at,
                    created_at, updated_at
                ) VALUES (
                    :id, :runId, :caseId, :caseVersion, :status, :comment,
                    :elapsed, CAST(:defects AS JSONB), :executedBy,
                    :executedAt, :createdAt, :updatedAt
                )
                """)
                .bind("id", result.id())
                .bind("runId", result.runId())
                .bind("caseId", result.caseId())
                .bind("caseVersion", result.caseVersion())
                .bind("status", result.status().value())
                .bind("comment", result.comment())
                .bind("elapsed", result.elapsedSeconds())
                .bind("defects", JsonColumns.toJson(result.defects()))
                .bind("executedBy", result.executedBy())
                .bind("executedAt", toTimestamp(result.executedAt()))
                .bind("createdAt", toTimestamp(result.createdAt()))
                .bind("updatedAt", toTimestamp(result.updatedAt()))
                .execute());
    }

    public void update(final TestResult result) {
        jdbi.useHandle(handle -> handle.createUpdate("""
                UPDATE test_results SET
                    status = :status,
                    comment = :comment,
                    elapsed = :elapsed,
                    defects = CAST(:defects AS JSONB),
                    executed_by = :executedBy,
                    executed_at = :executedAt,
                    updated_at = :updatedAt
                WHERE id = :id
                """)
                .bind("id", result.id())
                .bind("status", result.status().value())
                .bind("comment", result.comment())
                .bind("elapsed", result.elapsedSeconds())
                .bind("defects", JsonColumns.toJson(result.defects()))
                .bind("executedBy", result.executedBy())
                .bind("executedAt", toTimestamp(result.executedAt()))
                .bind("updatedAt", toTimestamp(result.updatedAt()))
                .execute());
    }

    public List<TestResult> findByRun(final String runId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(FIND_BY_RUN)
                .bind("runId", runId)
                .map(new TestResultRowMapper())
                .list());
    }

    public Optional<TestResult> findById(final String runId,
            final String id) {
        return jdbi.withHandle(handle -> handle
                .createQuery("""
                        SELECT * FROM test_results
                        WHERE id = :id AND run_id = :runId
                        """)
                .bind("id", id)
                .bind("runId", runId)
                .map(new TestResultRowMapper())
                .findOne());
    }

    public boolean exists(final String runId, final String caseId) {
        return !caseIdsIn(runId, Set.of(caseId)).isEmpty();
    }

    /**
     * Returns which of the given cases already have a result in a run.
     *
     * @param runId the run ID
     * @param caseIds the candidate case IDs
     * @return the subset already present
     */
    public Set<String> caseIdsIn(final String runId,
            final Collection<String> caseIds) {
        if (caseIds.isEmpty()) {
            return Set.of();
        }
        return jdbi.withHandle(handle -> handle
                .createQuery("""
                        SELECT case_id FROM test_results
                        WHERE run_id = :runId AND case_id IN (<caseIds>)
                        """)
                .bind("runId", runId)
                .bindList("caseIds", caseIds)
                .mapTo(String.class)
                .collect(Collectors.toCollection(HashSet::new)));
    }

    /**
     * Counts the results of a run per status.
     *
     * @param runId the run ID
     * @return the tally
     */
    public StatusTally tally(final String runId) {
        final Map<TestResultStatus, Long> counts = new EnumMap<>(
                TestResultStatus.class);
        jdbi.useHandle(handle -> handle
                .createQuery(COUNT_BY_STATUS)
                .bind("runId", runId)
                .map((rs, ctx) -> Map.entry(
                        TestResultStatus.fromValue(rs.getString("status")),
                        rs.getLong("total")))
                .forEach(entry -> counts.put(entry.getKey(),
                        entry.getValue())));
        return StatusTally.of(counts);
    }

    public void delete(final String id) {
        jdbi.useHandle(handle -> handle
                .createUpdate("DELETE FROM test_results WHERE id = :id")
                .bind("id", id)
                .execute());
    }

    private static Timestamp toTimestamp(final Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static final class TestResultRowMapper
            implements RowMapper<TestResult> {

        @Override
        public TestResult map(final ResultSet rs, final StatementContext ctx)
                throws SQLException {
            final int elapsed = rs.getInt("elapsed");
            final boolean hasElapsed = !rs.wasNull();
            final Timestamp executedTs = rs.getTimestamp("executed_at");
            return TestResult.reconstitute(
                    rs.getString("id"),
                    rs.getString("run_id"),
                    rs.getString("case_id"),
                    rs.getInt("case_version"),
                    TestResultStatus.fromValue(rs.getString("status")),
                    rs.getString("comment"),
                    hasElapsed ? elapsed : null,
                    JsonColumns.fromJson(rs.getString("defects"),
                            JsonColumns.STRING_LIST),
                    rs.getString("executed_by"),
                    executedTs != null ? executedTs.toInstant() : null,
                    rs.getTimestamp("created_at").toInstant(),
                    rs.getTimestamp("updated_at").toInstant());
        }
    }

}
