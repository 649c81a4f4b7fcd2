package co.fanki.qualityhub.dashboard.domain;

/**
 * Flat headline numbers of a project, taken from the dashboard widgets.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DashboardStats(
        long totalTestCases,
        long totalExecuted,
        long passed,
        long failed,
        long blocked,
        long remaining,
        int passRate,
        int executionProgress,
        long totalTestRuns,
        long activeTestRuns,
        long completedTestRuns,
        long totalRequirements,
        int coveragePercentage,
        long totalDefects,
        long failedTestsWithDefects
) {}
