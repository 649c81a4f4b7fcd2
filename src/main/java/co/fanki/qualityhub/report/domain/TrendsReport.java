package co.fanki.qualityhub.report.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Daily pass rate and defect discovery of a project over a period.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TrendsReport(
        String projectId,
        LocalDate periodStart,
        LocalDate periodEnd,
        List<ExecutionPoint> executionTrends,
        List<DefectPoint> defectTrends,
        int averagePassRate,
        int passRateTrend,
        Instant generatedAt
) {

    /** Execution figures of one day. */
    public record ExecutionPoint(
            LocalDate date,
            int passRate,
            long testsExecuted,
            long passed,
            long failed
    ) {}

    /**
     * Defects first seen on one day.
     *
     * @param date the day
     * @param newDefects defect ids not seen on any earlier day
     * @param cumulativeDefects distinct defect ids seen so far
     */
    public record DefectPoint(
            LocalDate date,
            long newDefects,
            long cumulativeDefects
    ) {}

}
