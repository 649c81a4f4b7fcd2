package co.fanki.qualityhub.report.domain;

import co.fanki.qualityhub.report.domain.CoverageReport.RequirementLine;
import co.fanki.qualityhub.requirement.domain.RequirementStatus;
import co.fanki.qualityhub.run.domain.StatusTally;
import co.fanki.qualityhub.run.domain.TestResultStatus;
import co.fanki.qualityhub.run.domain.TestRunStatus;
import co.fanki.qualityhub.shared.JsonColumns;
import org.jdbi.v3.core.Jdbi;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregate queries behind the project reports.
 *
 * <p>Only results of live runs and live requirements are counted. Days are
 * UTC calendar days.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class ReportRepository {

    /** Results of the project's live runs by status. Uses: idx_test_runs_project_id. */
    public static final String RESULT_STATUS_COUNTS = """
            SELECT r.status, COUNT(*) AS total
            FROM test_results r
            JOIN test_runs t ON t.id = r.run_id
            WHERE t.project_id = :projectId AND t.deleted_at IS NULL
            GROUP BY r.status
            """;

    /** Live runs by status. Uses: idx_test_runs_project_id. */
    public static final String RUN_STATUS_COUNTS = """
            SELECT status, COUNT(*) AS total
            FROM test_runs
            WHERE project_id = :projectId AND deleted_at IS NULL
            GROUP BY status
            """;

    /**
     * Linked case count per live requirement.
     * Uses: idx_requirements_project_id, uq_requirement_coverage_requirement_case.
     */
    public static final String REQUIREMENT_LINES = """
            SELECT q.id, q.external_id, q.title, q.status,
                   COUNT(c.id) AS linked
            FROM requirements q
            LEFT JOIN requirement_coverage c ON c.requirement_id = q.id
            WHERE q.project_id = :projectId AND q.deleted_at IS NULL
            GROUP BY q.id, q.external_id, q.title, q.status, q.created_at
            ORDER BY q.created_at
            """;

    /** Results carrying at least one defect id. Uses: idx_test_runs_project_id. */
    public static final String RESULTS_WITH_DEFECTS = """
            SELECT r.case_id, r.status, r.defects
            FROM test_results r
            JOIN test_runs t ON t.id = r.run_id
            WHERE t.project_id = :projectId AND t.deleted_at IS NULL
              AND r.defects IS NOT NULL
              AND r.defects <> '[]'::jsonb
            """;

    /**
     * Executed results in a period by day and status.
     * Uses: idx_test_results_executed_at.
     */
    public static final String DAILY_STATUS_COUNTS = """
            SELECT TO_CHAR(r.executed_at AT TIME ZONE 'UTC', 'YYYY-MM-DD')
                       AS day,
                   r.status, COUNT(*) AS total
            FROM test_results r
            JOIN test_runs t ON t.id = r.run_id
            WHERE t.project_id = :projectId AND t.deleted_at IS NULL
              AND r.executed_at IS NOT NULL
              AND r.executed_at >= :from AND r.executed_at < :to
            GROUP BY day, r.status
            ORDER BY day
            """;

    /**
     * Executed results in a period by tester and status.
     * Uses: idx_test_results_executed_at.
     */
    public static final String TESTER_STATUS_COUNTS = """
            SELECT r.executed_by, r.status, COUNT(*) AS total
            FROM test_results r
            JOIN test_runs t ON t.id = r.run_id
            WHERE t.project_id = :projectId AND t.deleted_at IS NULL
              AND r.executed_at IS NOT NULL
              AND r.executed_at >= :from AND r.executed_at < :to
            GROUP BY r.executed_by, r.status
            """;

    /**
     * Defect ids of results executed in a period, oldest first.
     * Uses: idx_test_results_executed_at.
     */
    public static final String DATED_DEFECTS = """
            SELECT TO_CHAR(r.executed_at AT TIME ZONE 'UTC', 'YYYY-MM-DD')
                       AS day,
                   r.defects
            FROM test_results r
            JOIN test_runs t ON t.id = r.run_id
            WHERE t.project_id = :projectId AND t.deleted_at IS NULL
              AND r.executed_at IS NOT NULL
              AND r.executed_at >= :from AND r.executed_at < :to
              AND r.defects IS NOT NULL
              AND r.defects <> '[]'::jsonb
            ORDER BY r.executed_at
            """;

    private final Jdbi jdbi;

    /**
     * Creates a new ReportRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public ReportRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    public long countTestCases(final String projectId) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                        SELECT COUNT(*) FROM test_cases
                        WHERE project_id = :projectId AND deleted_at IS NULL
                        """)
                .bind("projectId", projectId)
                .mapTo(Long.class)
                .one());
    }

    public StatusTally resultTally(final String projectId) {
        final Map<TestResultStatus, Long> counts = new EnumMap<>(
                TestResultStatus.class);
        jdbi.useHandle(handle -> handle
                .createQuery(RESULT_STATUS_COUNTS)
                .bind("projectId", projectId)
                .map((rs, ctx) -> Map.entry(
                        TestResultStatus.fromValue(rs.getString("status")),
                        rs.getLong("total")))
                .forEach(entry -> counts.put(entry.getKey(),
                        entry.getValue())));
        return StatusTally.of(counts);
    }

    public Map<TestRunStatus, Long> runStatusCounts(final String projectId) {
        final Map<TestRunStatus, Long> counts = new EnumMap<>(
                TestRunStatus.class);
        jdbi.useHandle(handle -> handle
                .createQuery(RUN_STATUS_COUNTS)
                .bind("projectId", projectId)
                .map((rs, ctx) -> Map.entry(
                        TestRunStatus.fromValue(rs.getString("status")),
                        rs.getLong("total")))
                .forEach(entry -> counts.put(entry.getKey(),
                        entry.getValue())));
        return counts;
    }

    public List<RequirementLine> requirementLines(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(REQUIREMENT_LINES)
                .bind("projectId", projectId)
                .map((rs, ctx) -> new RequirementLine(
                        rs.getString("id"),
                        rs.getString("external_id"),
                        rs.getString("title"),
                        RequirementStatus.fromValue(rs.getString("status")),
                        rs.getLong("linked")))
                .list());
    }

    public long countFailedResults(final String projectId) {
        return jdbi.withHandle(handle -> handle.createQuery("""
                        SELECT COUNT(*)
                        FROM test_results r
                        JOIN test_runs t ON t.id = r.run_id
                        WHERE t.project_id = :projectId
                          AND t.deleted_at IS NULL
                          AND r.status = :failed
                        """)
                .bind("projectId", projectId)
                .bind("failed", TestResultStatus.FAILED.value())
                .mapTo(Long.class)
                .one());
    }

    public List<DefectedResult> resultsWithDefects(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(RESULTS_WITH_DEFECTS)
                .bind("projectId", projectId)
                .map((rs, ctx) -> new DefectedResult(
                        rs.getString("case_id"),
                        TestResultStatus.fromValue(rs.getString("status")),
                        defectsOf(rs.getString("defects"))))
                .list());
    }

    /**
     * Counts executed results per day and status.
     *
     * @param projectId the project ID
     * @param from inclusive lower bound
     * @param to exclusive upper bound
     * @return the counts, ordered by day
     */
    public List<DayStatusCount> dailyStatusCounts(final String projectId,
            final Instant from, final Instant to) {
        return jdbi.withHandle(handle -> handle
                .createQuery(DAILY_STATUS_COUNTS)
                .bind("projectId", projectId)
                .bind("from", Timestamp.from(from))
                .bind("to", Timestamp.from(to))
                .map((rs, ctx) -> new DayStatusCount(
                        LocalDate.parse(rs.getString("day")),
                        TestResultStatus.fromValue(rs.getString("status")),
                        rs.getLong("total")))
                .list());
    }

    public List<TesterStatusCount> testerStatusCounts(final String projectId,
            final Instant from, final Instant to) {
        return jdbi.withHandle(handle -> handle
                .createQuery(TESTER_STATUS_COUNTS)
                .bind("projectId", projectId)
                .bind("from", Timestamp.from(from))
                .bind("to", Timestamp.from(to))
                .map((rs, ctx) -> new TesterStatusCount(
                        rs.getString("executed_by"),
                        TestResultStatus.fromValue(rs.getString("status")),
                        rs.getLong("total")))
                .list());
    }

    public List<DatedDefects> datedDefects(final String projectId,
            final Instant from, final Instant to) {
        return jdbi.withHandle(handle -> handle
                .createQuery(DATED_DEFECTS)
                .bind("projectId", projectId)
                .bind("from", Timestamp.from(from))
                .bind("to", Timestamp.from(to))
                .map((rs, ctx) -> new DatedDefects(
                        LocalDate.parse(rs.getString("day")),
                        defectsOf(rs.getString("defects"))))
                .list());
    }

    private static List<String> defectsOf(final String json) {
        final List<String> defects = JsonColumns.fromJson(json,
                JsonColumns.STRING_LIST);
        return defects != null ? defects : List.of();
    }

    /** A result that references defects. */
    public record DefectedResult(
            String caseId,
            TestResultStatus status,
            List<String> defects
    ) {}

    /** Executed results of one day with one status. */
    public record DayStatusCount(
            LocalDate day,
            TestResultStatus status,
            long count
    ) {}

    /** Executed results of one tester with one status. */
    public record TesterStatusCount(
            String userId,
            TestResultStatus status,
            long count
    ) {}

    /** Defects referenced by a result executed on a day. */
    public record DatedDefects(
            LocalDate day,
            List<String> defects
    ) {}

}
