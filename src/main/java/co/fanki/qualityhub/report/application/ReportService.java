package co.fanki.qualityhub.report.application;

import co.fanki.qualityhub.report.domain.ActivityReport;
import co.fanki.qualityhub.report.domain.ActivityReport.DailyActivity;
import co.fanki.qualityhub.report.domain.ActivityReport.TesterActivity;
import co.fanki.qualityhub.report.domain.CoverageReport;
import co.fanki.qualityhub.report.domain.CoverageReport.RequirementLine;
import co.fanki.qualityhub.report.domain.DefectsReport;
import co.fanki.qualityhub.report.domain.DefectsReport.DefectLine;
import co.fanki.qualityhub.report.domain.ProjectSummary;
import co.fanki.qualityhub.report.domain.ProjectSummary.TestExecutionSummary;
import co.fanki.qualityhub.report.domain.ProjectSummary.TestRunSummary;
import co.fanki.qualityhub.report.domain.ReportRepository;
import co.fanki.qualityhub.report.domain.ReportRepository.DatedDefects;
import co.fanki.qualityhub.report.domain.ReportRepository.DayStatusCount;
import co.fanki.qualityhub.report.domain.ReportRepository.DefectedResult;
import co.fanki.qualityhub.report.domain.ReportRepository.TesterStatusCount;
import co.fanki.qualityhub.report.domain.TrendsReport;
import co.fanki.qualityhub.report.domain.TrendsReport.DefectPoint;
import co.fanki.qualityhub.report.domain.TrendsReport.ExecutionPoint;
import co.fanki.qualityhub.requirement.application.RequirementService;
import co.fanki.qualityhub.run.domain.StatusTally;
import co.fanki.qualityhub.run.domain.TestResultStatus;
import co.fanki.qualityhub.run.domain.TestRunStatus;
import co.fanki.qualityhub.shared.Percentages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the project reports out of the aggregate queries.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ReportService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReportService.class);

    /** Days covered by period reports when no start date is given. */
    static final int DEFAULT_PERIOD_DAYS = 30;

    private final ReportRepository reportRepository;
    private final RequirementService requirementService;

    /**
     * Creates a new ReportService.
     *
     * @param theReportRepository the aggregate queries
     * @param theRequirementService the requirement service, for coverage
     */
    public ReportService(final ReportRepository theReportRepository,
            final RequirementService theRequirementService) {
        this.reportRepository = theReportRepository;
        this.requirementService = theRequirementService;
    }

    /**
     * Summarizes results, runs and requirement coverage of a project.
     *
     * @param projectId the project ID
     * @return the summary
     */
    public ProjectSummary summary(final String projectId) {
        final StatusTally tally = reportRepository.resultTally(projectId);
        final TestExecutionSummary execution = new TestExecutionSummary(
                reportRepository.countTestCases(projectId),
                tally.total(),
                tally.count(TestResultStatus.PASSED),
                tally.count(TestResultStatus.FAILED),
                tally.count(TestResultStatus.BLOCKED),
                tally.count(TestResultStatus.SKIPPED),
                tally.count(TestResultStatus.RETEST),
                tally.count(TestResultStatus.UNTESTED),
                tally.passRate(),
                tally.progressPercentage());

        final Map<TestRunStatus, Long> runs = reportRepository
                .runStatusCounts(projectId);
        final TestRunSummary runSummary = new TestRunSummary(
                runs.values().stream().mapToLong(Long::longValue).sum(),
                runs.getOrDefault(TestRunStatus.NOT_STARTED, 0L),
                runs.getOrDefault(TestRunStatus.IN_PROGRESS, 0L),
                runs.getOrDefault(TestRunStatus.COMPLETED, 0L),
                runs.getOrDefault(TestRunStatus.ABORTED, 0L));

        return new ProjectSummary(projectId, execution, runSummary,
                requirementService.projectStatistics(projectId),
                Instant.now());
    }

    /**
     * Lists every live requirement with the number of cases linked to it.
     *
     * @param projectId the project ID
     * @return the report
     */
    public CoverageReport coverage(final String projectId) {
        final List<RequirementLine> lines = reportRepository
                .requirementLines(projectId);
        final long covered = lines.stream()
                .filter(RequirementLine::isCovered)
                .count();
        return new CoverageReport(projectId, lines.size(), covered,
                lines.size() - covered,
                Percentages.of(covered, lines.size()),
                lines, Instant.now());
    }

    /**
     * Groups the defect ids referenced by results.
     *
     * @param projectId the project ID
     * @return the report
     */
    public DefectsReport defects(final String projectId) {
        final List<DefectedResult> results = reportRepository
                .resultsWithDefects(projectId);
        final long totalFailed = reportRepository.countFailedResults(
                projectId);

        final Map<String, Long> linked = new LinkedHashMap<>();
        final Map<String, Set<String>> cases = new LinkedHashMap<>();
        long failedWithDefects = 0;

        for (DefectedResult result : results) {
            if (result.status() == TestResultStatus.FAILED) {
                failedWithDefects++;
            }
            for (String defectId : result.defects()) {
                linked.merge(defectId, 1L, Long::sum);
                cases.computeIfAbsent(defectId, id -> new HashSet<>())
                        .add(result.caseId());
            }
        }

        final List<DefectLine> defects = new ArrayList<>();
        linked.forEach((defectId, count) -> defects.add(new DefectLine(
                defectId, count, cases.get(defectId).size())));
        defects.sort(Comparator.comparingLong(DefectLine::linkedTestResults)
                .reversed());

        return new DefectsReport(projectId, defects.size(), totalFailed,
                failedWithDefects, totalFailed - failedWithDefects, defects,
                Instant.now());
    }

    /**
     * Tallies executed results per day and per tester in a period.
     *
     * @param projectId the project ID
     * @param start first day, defaults to thirty days before the end
     * @param end last day, defaults to today
     * @return the report
     */
    public ActivityReport activity(final String projectId,
            final LocalDate start, final LocalDate end) {
        final Period period = Period.of(start, end);

        final List<DailyActivity> daily = new ArrayList<>();
        dailyCounters(reportRepository.dailyStatusCounts(projectId,
                period.from(), period.to())).forEach((day, counter) ->
                daily.add(new DailyActivity(day, counter.executed,
                        counter.passed, counter.failed)));

        final Map<String, Counter> perTester = new LinkedHashMap<>();
        for (TesterStatusCount row : reportRepository.testerStatusCounts(
                projectId, period.from(), period.to())) {
            perTester.computeIfAbsent(row.userId(), id -> new Counter())
                    .add(row.status(), row.count());
        }
        final List<TesterActivity> testers = new ArrayList<>();
        perTester.forEach((userId, counter) -> testers.add(
                new TesterActivity(userId, counter.executed, counter.passed,
                        counter.failed, counter.passRate())));
        testers.sort(Comparator.comparingLong(TesterActivity::testsExecuted)
                .reversed());

        final long total = daily.stream()
                .mapToLong(DailyActivity::testsExecuted)
                .sum();

        LOG.debug("Activity report for project {} from {} to {}: {} results",
                projectId, period.start(), period.end(), total);

        return new ActivityReport(projectId, period.start(), period.end(),
                total, daily, testers, Instant.now());
    }

    /**
     * Computes the daily pass rate and when defects were first seen in a
     * period.
     *
     * @param projectId the project ID
     * @param start first day, defaults to thirty days before the end
     * @param end last day, defaults to today
     * @return the report
     */
    public TrendsReport trends(final String projectId, final LocalDate start,
            final LocalDate end) {
        final Period period = Period.of(start, end);

        final List<ExecutionPoint> execution = new ArrayList<>();
        dailyCounters(reportRepository.dailyStatusCounts(projectId,
                period.from(), period.to())).forEach((day, counter) ->
                execution.add(new ExecutionPoint(day, counter.passRate(),
                        counter.executed, counter.passed, counter.failed)));

        final Map<LocalDate, Set<String>> firstSeen = new TreeMap<>();
        final Set<String> seen = new HashSet<>();
        for (DatedDefects row : reportRepository.datedDefects(projectId,
                period.from(), period.to())) {
            final Set<String> onDay = firstSeen.computeIfAbsent(row.day(),
                    day -> new HashSet<>());
            for (String defectId : row.defects()) {
                if (seen.add(defectId)) {
                    onDay.add(defectId);
                }
            }
        }
        final List<DefectPoint> defects = new ArrayList<>();
        long cumulative = 0;
        for (Map.Entry<LocalDate, Set<String>> entry : firstSeen.entrySet()) {
            cumulative += entry.getValue().size();
            defects.add(new DefectPoint(entry.getKey(),
                    entry.getValue().size(), cumulative));
        }

        int average = 0;
        int trend = 0;
        if (!execution.isEmpty()) {
            final int sum = execution.stream()
                    .mapToInt(ExecutionPoint::passRate)
                    .sum();
            average = Math.round((float) sum / execution.size());
            trend = execution.get(execution.size() - 1).passRate()
                    - execution.get(0).passRate();
        }

        return new TrendsReport(projectId, period.start(), period.end(),
                execution, defects, average, trend, Instant.now());
    }

    private static Map<LocalDate, Counter> dailyCounters(
            final List<DayStatusCount> rows) {
        final Map<LocalDate, Counter> perDay = new TreeMap<>();
        for (DayStatusCount row : rows) {
            perDay.computeIfAbsent(row.day(), day -> new Counter())
                    .add(row.status(), row.count());
        }
        return perDay;
    }

    /** Running totals of executed, passed and failed results. */
    private static final class Counter {

        private long executed;
        private long passed;
        private long failed;

        void add(final TestResultStatus status, final long count) {
            executed += count;
            if (status == TestResultStatus.PASSED) {
                passed += count;
            } else if (status == TestResultStatus.FAILED) {
                failed += count;
            }
        }

        int passRate() {
            return Percentages.of(passed, executed);
        }
    }

    /**
     * Inclusive day range of a report, with its UTC instant bounds.
     *
     * @param start the first day
     * @param end the last day
     */
    record Period(LocalDate start, LocalDate end) {

        static Period of(final LocalDate start, final LocalDate end) {
            final LocalDate last = end != null
                    ? end : LocalDate.now(ZoneOffset.UTC);
            final LocalDate first = start != null
                    ? start : last.minusDays(DEFAULT_PERIOD_DAYS);
            if (first.isAfter(last)) {
                throw new IllegalArgumentException(
                        "startDate must not be after endDate");
            }
            return new Period(first, last);
        }

        Instant from() {
            return start.atStartOfDay(ZoneOffset.UTC).toInstant();
        }

        Instant to() {
            return end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
    }

}
