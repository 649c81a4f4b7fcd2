package co.fanki.qualityhub.dashboard.domain;

import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.RecentExecution;
import co.fanki.qualityhub.run.domain.TestResultStatus;
import co.fanki.qualityhub.run.domain.TestRunStatus;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Query;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only queries behind the dashboard that the report queries do not
 * cover: run progress, the latest events and pending work.
 *
 * <p>Deleted runs, milestones, cases and requirements are never returned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Repository
public class DashboardRepository {

    /**
     * Live runs in some statuses with their result counts.
     * Uses: idx_test_runs_project_id, idx_test_results_run_status.
     */
    public static final String RUN_PROGRESS = """
            SELECT t.id, t.name, t.status, t.assignee_id, t.started_at,
                   COUNT(r.id) AS total,
                   COUNT(r.id) FILTER (WHERE r.status <> 'untested')
                       AS executed
            FROM test_runs t
            LEFT JOIN test_results r ON r.run_id = t.id
            WHERE t.project_id = :projectId AND t.deleted_at IS NULL
              AND t.status IN (<statuses>)
              <assigneeFilter>
            GROUP BY t.id, t.name, t.status, t.assignee_id, t.started_at,
                     t.created_at
            ORDER BY t.started_at DESC NULLS LAST, t.created_at DESC
            LIMIT :limit
            """;

    /** Latest executed results. Uses: idx_test_results_executed_at. */
    public static final String RECENT_EXECUTIONS = """
            SELECT r.id, r.run_id, r.case_id, c.title, r.status,
                   r.executed_by, r.executed_at
            FROM test_results r
            JOIN test_runs t ON t.id = r.run_id
            JOIN test_cases c ON c.id = r.case_id
            WHERE t.project_id = :projectId AND t.deleted_at IS NULL
              AND r.executed_at IS NOT NULL
            ORDER BY r.executed_at DESC
            LIMIT :limit
            """;

    /** Live runs that started or finished, latest first. */
    public static final String RUN_EVENTS = """
            SELECT id, name, status, assignee_id, started_at, completed_at
            FROM test_runs
            WHERE project_id = :projectId AND deleted_at IS NULL
              AND (started_at IS NOT NULL OR completed_at IS NOT NULL)
            ORDER BY COALESCE(completed_at, started_at) DESC
            LIMIT :limit
            """;

    /** Completed live milestones, latest first. */
    public static final String COMPLETED_MILESTONES = """
            SELECT id, name, due_date, updated_at
            FROM milestones
            WHERE project_id = :projectId AND deleted_at IS NULL
              AND is_completed = TRUE
            ORDER BY updated_at DESC
            LIMIT :limit
            """;

    /**
     * Incomplete live milestones due before a moment, overdue ones included.
     * Uses: idx_milestones_project_completed.
     */
    public static final String MILESTONES_DUE_BEFORE = """
            SELECT id, name, due_date, updated_at
            FROM milestones
            WHERE project_id = :projectId AND deleted_at IS NULL
              AND is_completed = FALSE
              AND due_date IS NOT NULL AND due_date < :until
            ORDER BY due_date
            """;

    /** Distinct cases linked to live requirements. */
    public static final String LINKED_TEST_CASES = """
            SELECT COUNT(DISTINCT c.case_id)
            FROM requirement_coverage c
            JOIN requirements q ON q.id = c.requirement_id
            WHERE q.project_id = :projectId AND q.deleted_at IS NULL
            """;

    /** Results with one status in the live in-progress runs. */
    public static final String ACTIVE_RUN_RESULTS = """
            SELECT COUNT(*)
            FROM test_results r
            JOIN test_runs t ON t.id = r.run_id
            WHERE t.project_id = :projectId AND t.deleted_at IS NULL
              AND t.status = :inProgress
              AND r.status = :status
              <defectsFilter>
            """;

    private static final String WITHOUT_DEFECTS =
            "AND (r.defects IS NULL OR r.defects = '[]'::jsonb)";

    private final Jdbi jdbi;

    /**
     * Creates a new DashboardRepository.
     *
     * @param theJdbi the JDBI instance
     */
    public DashboardRepository(final Jdbi theJdbi) {
        this.jdbi = theJdbi;
    }

    /**
     * Lists the in-progress runs, most recently started first.
     *
     * @param projectId the project ID
     * @param limit the maximum number of runs
     * @return the runs with their result counts
     */
    public List<RunProgress> activeRuns(final String projectId,
            final int limit) {
        return runProgress(projectId, List.of(TestRunStatus.IN_PROGRESS),
                null, limit);
    }

    /**
     * Lists the runs still to be finished, optionally only those assigned
     * to a user.
     *
     * @param projectId the project ID
     * @param assigneeId the assignee, or null for every run
     * @param limit the maximum number of runs
     * @return the in-progress and not-started runs
     */
    public List<RunProgress> openRuns(final String projectId,
            final String assigneeId, final int limit) {
        return runProgress(projectId, List.of(TestRunStatus.IN_PROGRESS,
                TestRunStatus.NOT_STARTED), assigneeId, limit);
    }

    public List<RecentExecution> recentExecutions(final String projectId,
            final int limit) {
        return jdbi.withHandle(handle -> handle
                .createQuery(RECENT_EXECUTIONS)
                .bind("projectId", projectId)
                .bind("limit", limit)
                .map((rs, ctx) -> new RecentExecution(
                        rs.getString("id"),
                        rs.getString("run_id"),
                        rs.getString("case_id"),
                        rs.getString("title"),
                        TestResultStatus.fromValue(rs.getString("status")),
                        rs.getString("executed_by"),
                        instantOf(rs.getTimestamp("executed_at"))))
                .list());
    }

    public List<RunEvent> runEvents(final String projectId,
            final int limit) {
        return jdbi.withHandle(handle -> handle
                .createQuery(RUN_EVENTS)
                .bind("projectId", projectId)
                .bind("limit", limit)
                .map((rs, ctx) -> new RunEvent(
                        rs.getString("id"),
                        rs.getString("name"),
                        TestRunStatus.fromValue(rs.getString("status")),
                        rs.getString("assignee_id"),
                        instantOf(rs.getTimestamp("started_at")),
                        instantOf(rs.getTimestamp("completed_at"))))
                .list());
    }

    public List<MilestoneMark> completedMilestones(final String projectId,
            final int limit) {
        return jdbi.withHandle(handle -> handle
                .createQuery(COMPLETED_MILESTONES)
                .bind("projectId", projectId)
                .bind("limit", limit)
                .map((rs, ctx) -> milestoneOf(rs.getString("id"),
                        rs.getString("name"),
                        rs.getTimestamp("due_date"),
                        rs.getTimestamp("updated_at")))
                .list());
    }

    /**
     * Lists the incomplete milestones due before a moment.
     *
     * @param projectId the project ID
     * @param until exclusive upper bound of the due date
     * @return the milestones, earliest due first
     */
    public List<MilestoneMark> milestonesDueBefore(final String projectId,
            final Instant until) {
        return jdbi.withHandle(handle -> handle
                .createQuery(MILESTONES_DUE_BEFORE)
                .bind("projectId", projectId)
                .bind("until", Timestamp.from(until))
                .map((rs, ctx) -> milestoneOf(rs.getString("id"),
                        rs.getString("name"),
                        rs.getTimestamp("due_date"),
                        rs.getTimestamp("updated_at")))
                .list());
    }

    public long countLinkedTestCases(final String projectId) {
        return jdbi.withHandle(handle -> handle
                .createQuery(LINKED_TEST_CASES)
                .bind("projectId", projectId)
                .mapTo(Long.class)
                .one());
    }

    public long countBlockedInActiveRuns(final String projectId) {
        return countActiveRunResults(projectId, TestResultStatus.BLOCKED,
                "");
    }

    public long countFailedWithoutDefectsInActiveRuns(
            final String projectId) {
        return countActiveRunResults(projectId, TestResultStatus.FAILED,
                WITHOUT_DEFECTS);
    }

    /**
     * Resolves user names.
     *
     * @param userIds the user IDs, may be empty
     * @return the name of each user found, keyed by ID
     */
    public Map<String, String> userNames(final Collection<String> userIds) {
        final Map<String, String> names = new HashMap<>();
        if (userIds.isEmpty()) {
            return names;
        }
        jdbi.useHandle(handle -> handle
                .createQuery("SELECT id, name FROM users WHERE id IN (<ids>)")
                .bindList("ids", userIds)
                .map((rs, ctx) -> Map.entry(rs.getString("id"),
                        rs.getString("name")))
                .forEach(entry -> names.put(entry.getKey(),
                        entry.getValue())));
        return names;
    }

    private List<RunProgress> runProgress(final String projectId,
            final List<TestRunStatus> statuses, final String assigneeId,
            final int limit) {
        final List<String> values = statuses.stream()
                .map(TestRunStatus::value)
                .toList();
        return jdbi.withHandle(handle -> {
            final Query query = handle.createQuery(RUN_PROGRESS)
                    .define("assigneeFilter", assigneeId != null
                            ? "AND t.assignee_id = :assigneeId" : "")
                    .bind("projectId", projectId)
                    .bindList("statuses", values)
                    .bind("limit", limit);
            if (assigneeId != null) {
                query.bind("assigneeId", assigneeId);
            }
            return query
                    .map((rs, ctx) -> new RunProgress(
                            rs.getString("id"),
                            rs.getString("name"),
                            TestRunStatus.fromValue(rs.getString("status")),
                            rs.getString("assignee_id"),
                            instantOf(rs.getTimestamp("started_at")),
                            rs.getLong("total"),
                            rs.getLong("executed")))
                    .list();
        });
    }

    private long countActiveRunResults(final String projectId,
            final TestResultStatus status, final String defectsFilter) {
        return jdbi.withHandle(handle -> handle
                .createQuery(ACTIVE_RUN_RESULTS)
                .define("defectsFilter", defectsFilter)
                .bind("projectId", projectId)
                .bind("inProgress", TestRunStatus.IN_PROGRESS.value())
                .bind("status", status.value())
                .mapTo(Long.class)
                .one());
    }

    private static MilestoneMark milestoneOf(final String id,
            final String name, final Timestamp dueDate,
            final Timestamp updatedAt) {
        return new MilestoneMark(id, name, instantOf(dueDate),
                instantOf(updatedAt));
    }

    private static Instant instantOf(final Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    /**
     * A run with its result counts.
     *
     * @param id the run ID
     * @param name the run name
     * @param status the run status
     * @param assigneeId the assignee, may be null
     * @param startedAt when it started, may be null
     * @param totalResults results of the run
     * @param executedResults results no longer untested
     */
    public record RunProgress(
            String id,
            String name,
            TestRunStatus status,
            String assigneeId,
            Instant startedAt,
            long totalResults,
            long executedResults
    ) {

        public long remaining() {
            return totalResults - executedResults;
        }
    }

    /** A run that started or finished. */
    public record RunEvent(
            String id,
            String name,
            TestRunStatus status,
            String assigneeId,
            Instant startedAt,
            Instant completedAt
    ) {

        /** When the run last moved: its completion, or else its start. */
        public Instant lastMovedAt() {
            return completedAt != null ? completedAt : startedAt;
        }
    }

    /** A milestone with its due date and last update. */
    public record MilestoneMark(
            String id,
            String name,
            Instant dueDate,
            Instant updatedAt
    ) {}

}
