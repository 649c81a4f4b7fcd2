package co.fanki.qualityhub.report.domain;

import co.fanki.qualityhub.requirement.domain.CoverageStatistics;

import java.time.Instant;

/**
 * Dashboard view of a project: how its results, runs and requirements
 * stand right now.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ProjectSummary(
        String projectId,
        TestExecutionSummary testExecution,
        TestRunSummary testRuns,
        CoverageStatistics requirementCoverage,
        Instant generatedAt
) {

    /**
     * Results of every live run of the project, by status.
     *
     * @param totalTestCases live test cases of the project
     * @param totalTestResults results across all runs
     * @param passed passed results
     * @param failed failed results
     * @param blocked blocked results
     * @param skipped skipped results
     * @param retest results marked for retest
     * @param untested results not executed yet
     * @param passRate passed over executed results
     * @param executionProgress executed over all results
     */
    public record TestExecutionSummary(
            long totalTestCases,
            long totalTestResults,
            long passed,
            long failed,
            long blocked,
            long skipped,
            long retest,
            long untested,
            int passRate,
            int executionProgress
    ) {}

    /** Live runs of the project, by status. */
    public record TestRunSummary(
            long total,
            long notStarted,
            long inProgress,
            long completed,
            long aborted
    ) {}

}
