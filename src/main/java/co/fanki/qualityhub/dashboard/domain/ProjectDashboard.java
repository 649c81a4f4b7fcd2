package co.fanki.qualityhub.dashboard.domain;

import co.fanki.qualityhub.run.domain.TestResultStatus;
import co.fanki.qualityhub.run.domain.TestRunStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Every widget of a project dashboard, computed at the same moment.
 *
 * @param projectId the project ID
 * @param testExecution results of the project's runs
 * @param testRuns run counts and the active runs
 * @param recentActivity today's executions and the latest ones
 * @param coverage requirement coverage
 * @param defects defects referenced by results
 * @param trends daily pass rate over the last days
 * @param generatedAt when the dashboard was computed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProjectDashboard(
        String projectId,
        TestExecutionWidget testExecution,
        TestRunsWidget testRuns,
        RecentActivityWidget recentActivity,
        CoverageWidget coverage,
        DefectsWidget defects,
        TrendsWidget trends,
        Instant generatedAt
) {

    /**
     * Results of the project's runs.
     *
     * <p>Passed, failed and blocked results count as executed; untested,
     * skipped and retest ones are still remaining.</p>
     *
     * @param totalTestCases live cases of the project
     * @param totalExecuted passed, failed and blocked results
     * @param passed passed results
     * @param failed failed results
     * @param blocked blocked results
     * @param remaining untested, skipped and retest results
     * @param passRate passed among executed, rounded
     * @param executionProgress executed among all results, rounded
     */
    public record TestExecutionWidget(
            long totalTestCases,
            long totalExecuted,
            long passed,
            long failed,
            long blocked,
            long remaining,
            int passRate,
            int executionProgress
    ) {}

    public record TestRunsWidget(
            long total,
            long activeCount,
            long completedCount,
            long pendingCount,
            List<ActiveRun> activeRuns
    ) {}

    public record ActiveRun(
            String id,
            String name,
            TestRunStatus status,
            int progress,
            String assigneeId,
            Instant startedAt
    ) {}

    public record RecentActivityWidget(
            long testsExecutedToday,
            long passedToday,
            long failedToday,
            List<RecentExecution> recentExecutions
    ) {}

    /**
     * An executed result with the title of its case.
     *
     * @param id the result ID
     * @param runId the run of the result
     * @param testCaseId the case ID
     * @param testCaseTitle the case title
     * @param status the result status
     * @param executedBy who executed it, may be null
     * @param executedAt when it was executed
     */
    public record RecentExecution(
            String id,
            String runId,
            String testCaseId,
            String testCaseTitle,
            TestResultStatus status,
            String executedBy,
            Instant executedAt
    ) {}

    public record CoverageWidget(
            long totalRequirements,
            long coveredRequirements,
            long uncoveredRequirements,
            int coveragePercentage,
            long linkedTestCases
    ) {}

    public record DefectsWidget(
            long totalDefects,
            long totalFailedTests,
            long failedTestsWithDefects,
            long failedTestsWithoutDefects,
            List<TopDefect> topDefects
    ) {}

    public record TopDefect(
            String defectId,
            long linkedTestResults,
            long affectedTestCases
    ) {}

    /**
     * Pass rate per day over the last days.
     *
     * @param periodDays how many days back the widget looks
     * @param averagePassRate mean of the daily pass rates, rounded
     * @param passRateTrend last day's pass rate minus the first day's
     * @param totalTestsExecuted results executed in the period
     * @param trendData one point per day with executions
     */
    public record TrendsWidget(
            int periodDays,
            int averagePassRate,
            int passRateTrend,
            long totalTestsExecuted,
            List<TrendPoint> trendData
    ) {}

    public record TrendPoint(
            LocalDate date,
            int passRate,
            long testsExecuted
    ) {}

}
