package co.fanki.qualityhub.report.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Test execution activity of a project over a period.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ActivityReport(
        String projectId,
        LocalDate periodStart,
        LocalDate periodEnd,
        long totalTestsExecuted,
        List<DailyActivity> dailyActivity,
        List<TesterActivity> testerActivity,
        Instant generatedAt
) {

    /** Results executed on one day. */
    public record DailyActivity(
            LocalDate date,
            long testsExecuted,
            long passed,
            long failed
    ) {}

    /**
     * Results executed by one tester, a null user for results whose
     * executor is unknown.
     */
    public record TesterActivity(
            String userId,
            long testsExecuted,
            long passed,
            long failed,
            int passRate
    ) {}

}
