package co.fanki.qualityhub.report.domain;

import java.time.Instant;
import java.util.List;

/**
 * Defects referenced by the results of a project.
 *
 * <p>Defects are sorted by the number of results linking them, most
 * linked first.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DefectsReport(
        String projectId,
        long totalDefects,
        long totalFailedTests,
        long failedTestsWithDefects,
        long failedTestsWithoutDefects,
        List<DefectLine> defects,
        Instant generatedAt
) {

    /**
     * One defect id.
     *
     * @param defectId the external defect id
     * @param linkedTestResults results referencing it
     * @param affectedTestCases distinct cases among those results
     */
    public record DefectLine(
            String defectId,
            long linkedTestResults,
            long affectedTestCases
    ) {}

}
