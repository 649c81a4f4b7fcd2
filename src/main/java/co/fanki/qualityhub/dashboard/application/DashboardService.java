package co.fanki.qualityhub.dashboard.application;

import co.fanki.qualityhub.dashboard.domain.ActivityFeed;
import co.fanki.qualityhub.dashboard.domain.ActivityFeed.ActivityItem;
import co.fanki.qualityhub.dashboard.domain.ActivityFeed.ActivityType;
import co.fanki.qualityhub.dashboard.domain.DashboardRepository;
import co.fanki.qualityhub.dashboard.domain.DashboardRepository.MilestoneMark;
import co.fanki.qualityhub.dashboard.domain.DashboardRepository.RunEvent;
import co.fanki.qualityhub.dashboard.domain.DashboardRepository.RunProgress;
import co.fanki.qualityhub.dashboard.domain.DashboardStats;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.ActiveRun;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.CoverageWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.DefectsWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.RecentActivityWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.RecentExecution;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.TestExecutionWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.TestRunsWidget;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.TopDefect;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.TrendPoint;
import co.fanki.qualityhub.dashboard.domain.ProjectDashboard.TrendsWidget;
import co.fanki.qualityhub.dashboard.domain.TodoList;
import co.fanki.qualityhub.dashboard.domain.TodoList.TodoItem;
import co.fanki.qualityhub.dashboard.domain.TodoList.TodoItemType;
import co.fanki.qualityhub.dashboard.domain.TodoList.TodoPriority;
import co.fanki.qualityhub.report.application.ReportService;
import co.fanki.qualityhub.report.domain.DefectsReport;
import co.fanki.qualityhub.report.domain.ReportRepository;
import co.fanki.qualityhub.report.domain.ReportRepository.DayStatusCount;
import co.fanki.qualityhub.requirement.application.RequirementService;
import co.fanki.qualityhub.requirement.domain.CoverageStatistics;
import co.fanki.qualityhub.run.domain.StatusTally;
import co.fanki.qualityhub.run.domain.TestResultStatus;
import co.fanki.qualityhub.run.domain.TestRunStatus;
import co.fanki.qualityhub.shared.Percentages;
import co.fanki.qualityhub.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes the project dashboard widgets, the headline stats, the activity
 * feed and the to-do list.
 *
 * <p>"Today" is the current UTC calendar day.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class DashboardService {

    private static final Logger LOG = LoggerFactory.getLogger(
            DashboardService.class);

    /** Days the trends widget looks back when none are given. */
    public static final int DEFAULT_TREND_DAYS = 7;

    /** Largest look-back of the trends widget. */
    public static final int MAX_TREND_DAYS = 365;

    /** Events in the activity feed when no limit is given. */
    public static final int DEFAULT_ACTIVITY_LIMIT = 20;

    static final int ACTIVE_RUNS_SHOWN = 5;
    static final int RECENT_EXECUTIONS_SHOWN = 10;
    static final int TOP_DEFECTS_SHOWN = 5;
    static final int RUN_EVENTS_READ = 10;
    static final int MILESTONE_EVENTS_READ = 5;
    static final int OPEN_RUNS_READ = 50;

    /** Milestones due within this many days show up as upcoming. */
    static final int UPCOMING_MILESTONE_DAYS = 7;

    /** Upcoming milestones due within this many days are high priority. */
    static final int URGENT_MILESTONE_DAYS = 2;

    private final ReportRepository reportRepository;
    private final DashboardRepository dashboardRepository;
    private final ReportService reportService;
    private final RequirementService requirementService;
    private final Clock clock;

    /**
     * Creates a new DashboardService.
     *
     * @param theReportRepository the report aggregate queries
     * @param theDashboardRepository the dashboard queries
     * @param theReportService the report service, for defects
     * @param theRequirementService the requirement service, for coverage
     */
    @Autowired
    public DashboardService(final ReportRepository theReportRepository,
            final DashboardRepository theDashboardRepository,
            final ReportService theReportService,
            final RequirementService theRequirementService) {
        this(theReportRepository, theDashboardRepository, theReportService,
                theRequirementService, Clock.systemUTC());
    }

    DashboardService(final ReportRepository theReportRepository,
            final DashboardRepository theDashboardRepository,
            final ReportService theReportService,
            final RequirementService theRequirementService,
            final Clock theClock) {
        this.reportRepository = theReportRepository;
        this.dashboardRepository = theDashboardRepository;
        this.reportService = theReportService;
        this.requirementService = theRequirementService;
        this.clock = theClock;
    }

    /**
     * Computes every widget of a project dashboard.
     *
     * @param projectId the project ID
     * @return the dashboard
     */
    public ProjectDashboard dashboard(final String projectId) {
        final ProjectDashboard dashboard = new ProjectDashboard(projectId,
                testExecution(projectId),
                testRuns(projectId),
                recentActivity(projectId),
                coverage(projectId),
                defects(projectId),
                trends(projectId, DEFAULT_TREND_DAYS),
                clock.instant());
        LOG.debug("Dashboard computed for project {}", projectId);
        return dashboard;
    }

    /**
     * Counts the results of the project's runs.
     *
     * <p>Without runs every count is zero and all the project's cases are
     * remaining.</p>
     *
     * @param projectId the project ID
     * @return the widget
     */
    public TestExecutionWidget testExecution(final String projectId) {
        final long totalCases = reportRepository.countTestCases(projectId);
        final long runs = reportRepository.runStatusCounts(projectId)
                .values().stream()
                .mapToLong(Long::longValue)
                .sum();
        if (runs == 0) {
            return new TestExecutionWidget(totalCases, 0, 0, 0, 0,
                    totalCases, 0, 0);
        }
        final StatusTally tally = reportRepository.resultTally(projectId);
        final long passed = tally.count(TestResultStatus.PASSED);
        final long failed = tally.count(TestResultStatus.FAILED);
        final long blocked = tally.count(TestResultStatus.BLOCKED);
        final long executed = passed + failed + blocked;
        final long remaining = tally.sum(TestResultStatus.UNTESTED,
                TestResultStatus.SKIPPED, TestResultStatus.RETEST);
        return new TestExecutionWidget(totalCases, executed, passed, failed,
                blocked, remaining, Percentages.of(passed, executed),
                Percentages.of(executed, tally.total()));
    }

    /**
     * Counts the runs by status and lists the latest in-progress ones.
     *
     * @param projectId the project ID
     * @return the widget
     */
    public TestRunsWidget testRuns(final String projectId) {
        final Map<TestRunStatus, Long> counts = reportRepository
                .runStatusCounts(projectId);
        final long total = counts.values().stream()
                .mapToLong(Long::longValue)
                .sum();
        final List<ActiveRun> active = dashboardRepository
                .activeRuns(projectId, ACTIVE_RUNS_SHOWN).stream()
                .map(run -> new ActiveRun(run.id(), run.name(), run.status(),
                        Percentages.of(run.executedResults(),
                                run.totalResults()),
                        run.assigneeId(), run.startedAt()))
                .toList();
        return new TestRunsWidget(total,
                counts.getOrDefault(TestRunStatus.IN_PROGRESS, 0L),
                counts.getOrDefault(TestRunStatus.COMPLETED, 0L),
                counts.getOrDefault(TestRunStatus.NOT_STARTED, 0L),
                active);
    }

    /**
     * Counts today's executions and lists the latest ones.
     *
     * @param projectId the project ID
     * @return the widget
     */
    public RecentActivityWidget recentActivity(final String projectId) {
        final TodayCounts today = todayCounts(projectId);
        return new RecentActivityWidget(today.executed(), today.passed(),
                today.failed(), dashboardRepository.recentExecutions(
                        projectId, RECENT_EXECUTIONS_SHOWN));
    }

    /**
     * Requirement coverage plus the number of distinct linked cases.
     *
     * @param projectId the project ID
     * @return the widget, all zeros when the project has no requirements
     */
    public CoverageWidget coverage(final String projectId) {
        final CoverageStatistics stats = requirementService
                .projectStatistics(projectId);
        if (stats.totalRequirements() == 0) {
            return new CoverageWidget(0, 0, 0, 0, 0);
        }
        return new CoverageWidget(stats.totalRequirements(),
                stats.coveredRequirements(), stats.uncoveredRequirements(),
                stats.coveragePercentage(),
                dashboardRepository.countLinkedTestCases(projectId));
    }

    /**
     * Defect totals and the defects linked to most results.
     *
     * @param projectId the project ID
     * @return the widget
     */
    public DefectsWidget defects(final String projectId) {
        final DefectsReport report = reportService.defects(projectId);
        final List<TopDefect> top = report.defects().stream()
                .limit(TOP_DEFECTS_SHOWN)
                .map(line -> new TopDefect(line.defectId(),
                        line.linkedTestResults(), line.affectedTestCases()))
                .toList();
        return new DefectsWidget(report.totalDefects(),
                report.totalFailedTests(), report.failedTestsWithDefects(),
                report.failedTestsWithoutDefects(), top);
    }

    /**
     * Daily pass rate of the results executed in the last days.
     *
     * <p>The average is the mean of the daily rates, not the rate of all
     * results. The trend is the last day's rate minus the first day's, zero
     * with fewer than two days.</p>
     *
     * @param projectId the project ID
     * @param periodDays how many days to look back, between 1 and 365
     * @return the widget
     * @throws IllegalArgumentException if periodDays is out of range
     */
    public TrendsWidget trends(final String projectId, final int periodDays) {
        Preconditions.require(periodDays >= 1 && periodDays <= MAX_TREND_DAYS,
                "periodDays must be between 1 and " + MAX_TREND_DAYS);
        final Instant now = clock.instant();
        final Instant from = now.minus(Duration.ofDays(periodDays));

        final Map<LocalDate, long[]> perDay = new TreeMap<>();
        for (DayStatusCount row : reportRepository.dailyStatusCounts(
                projectId, from, startOfTomorrow())) {
            final long[] counts = perDay.computeIfAbsent(row.day(),
                    day -> new long[2]);
            counts[0] += row.count();
            if (row.status() == TestResultStatus.PASSED) {
                counts[1] += row.count();
            }
        }

        final List<TrendPoint> points = new ArrayList<>();
        long executed = 0;
        int rateSum = 0;
        for (Map.Entry<LocalDate, long[]> entry : perDay.entrySet()) {
            final long[] counts = entry.getValue();
            final int rate = Percentages.of(counts[1], counts[0]);
            points.add(new TrendPoint(entry.getKey(), rate, counts[0]));
            executed += counts[0];
            rateSum += rate;
        }

        final int average = points.isEmpty()
                ? 0 : Math.round((float) rateSum / points.size());
        final int trend = points.size() < 2
                ? 0 : points.get(points.size() - 1).passRate()
                        - points.get(0).passRate();
        return new TrendsWidget(periodDays, average, trend, executed, points);
    }

    /**
     * Flattens the widgets into the headline numbers.
     *
     * @param projectId the project ID
     * @return the stats
     */
    public DashboardStats stats(final String projectId) {
        final TestExecutionWidget execution = testExecution(projectId);
        final Map<TestRunStatus, Long> runs = reportRepository
                .runStatusCounts(projectId);
        final CoverageStatistics coverage = requirementService
                .projectStatistics(projectId);
        final DefectsReport defects = reportService.defects(projectId);
        return new DashboardStats(
                execution.totalTestCases(),
                execution.totalExecuted(),
                execution.passed(),
                execution.failed(),
                execution.blocked(),
                execution.remaining(),
                execution.passRate(),
                execution.executionProgress(),
                runs.values().stream().mapToLong(Long::longValue).sum(),
                runs.getOrDefault(TestRunStatus.IN_PROGRESS, 0L),
                runs.getOrDefault(TestRunStatus.COMPLETED, 0L),
                coverage.totalRequirements(),
                coverage.coveragePercentage(),
                defects.totalDefects(),
                defects.failedTestsWithDefects());
    }

    /**
     * Merges the latest executions, run starts and completions and
     * completed milestones into one feed, newest first.
     *
     * @param projectId the project ID
     * @param limit the maximum number of events, at least 1
     * @return the feed
     * @throws IllegalArgumentException if limit is below 1
     */
    public ActivityFeed activity(final String projectId, final int limit) {
        Preconditions.require(limit >= 1, "limit must be at least 1");
        final Instant todayStart = startOfToday();

        final List<RecentExecution> executions = dashboardRepository
                .recentExecutions(projectId, limit);
        final List<RunEvent> runs = dashboardRepository.runEvents(projectId,
                RUN_EVENTS_READ);
        final List<MilestoneMark> milestones = dashboardRepository
                .completedMilestones(projectId, MILESTONE_EVENTS_READ);

        final Set<String> userIds = new HashSet<>();
        executions.stream()
                .map(RecentExecution::executedBy)
                .filter(Objects::nonNull)
                .forEach(userIds::add);
        runs.stream()
                .map(RunEvent::assigneeId)
                .filter(Objects::nonNull)
                .forEach(userIds::add);
        final Map<String, String> names = dashboardRepository.userNames(
                userIds);

        final List<ActivityItem> items = new ArrayList<>();
        for (RecentExecution execution : executions) {
            final String userId = execution.executedBy() != null
                    ? execution.executedBy() : ActivityFeed.SYSTEM_USER;
            items.add(new ActivityItem(execution.id(),
                    ActivityType.TEST_EXECUTION, execution.testCaseTitle(),
                    execution.status(), userId, names.get(userId),
                    execution.executedAt(), execution.testCaseId(),
                    execution.runId()));
        }
        for (RunEvent run : runs) {
            final ActivityType type;
            if (run.completedAt() != null) {
                type = ActivityType.TEST_RUN_COMPLETED;
            } else if (run.status() == TestRunStatus.IN_PROGRESS) {
                type = ActivityType.TEST_RUN_STARTED;
            } else {
                continue;
            }
            final String userId = run.assigneeId() != null
                    ? run.assigneeId() : ActivityFeed.SYSTEM_USER;
            items.add(new ActivityItem("run-" + type.value() + "-" + run.id(),
                    type, run.name(), null, userId, names.get(userId),
                    run.lastMovedAt(), run.id(), null));
        }
        for (MilestoneMark milestone : milestones) {
            items.add(new ActivityItem("milestone-" + milestone.id(),
                    ActivityType.MILESTONE_COMPLETED, milestone.name(), null,
                    ActivityFeed.SYSTEM_USER, null, milestone.updatedAt(),
                    milestone.id(), null));
        }
        items.sort(Comparator.comparing(ActivityItem::timestamp,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())));

        final TodayCounts today = todayCounts(projectId);
        final long runsToday = runs.stream()
                .filter(run -> run.lastMovedAt() != null
                        && !run.lastMovedAt().isBefore(todayStart))
                .count();
        final long milestonesToday = milestones.stream()
                .filter(m -> !m.updatedAt().isBefore(todayStart))
                .count();

        return new ActivityFeed(
                today.executed() + runsToday + milestonesToday,
                today.executed(), today.passed(), today.failed(),
                items.size() > limit ? items.subList(0, limit) : items);
    }

    /**
     * Lists what is waiting in a project: open runs, overdue and upcoming
     * milestones, blocked results and failures without a defect.
     *
     * @param projectId the project ID
     * @param assigneeId only runs assigned to this user, or null for all
     * @return the list, most urgent first
     */
    public TodoList todo(final String projectId, final String assigneeId) {
        final Instant now = clock.instant();
        final List<TodoItem> items = new ArrayList<>();

        for (RunProgress run : dashboardRepository.openRuns(projectId,
                assigneeId, OPEN_RUNS_READ)) {
            final boolean started = run.status() == TestRunStatus.IN_PROGRESS;
            final long remaining = run.remaining();
            items.add(new TodoItem("run-" + run.id(),
                    TodoItemType.ASSIGNED_TEST_RUN, run.name(),
                    started
                            ? "Continue execution - " + remaining
                                    + " tests remaining"
                            : "Not started - " + run.totalResults()
                                    + " tests to execute",
                    started ? TodoPriority.HIGH : TodoPriority.MEDIUM,
                    null, run.id(),
                    Percentages.of(run.executedResults(), run.totalResults()),
                    remaining));
        }

        for (MilestoneMark milestone : dashboardRepository
                .milestonesDueBefore(projectId,
                        now.plus(Duration.ofDays(UPCOMING_MILESTONE_DAYS)))) {
            if (milestone.dueDate().isBefore(now)) {
                items.add(new TodoItem("milestone-" + milestone.id(),
                        TodoItemType.OVERDUE_MILESTONE, milestone.name(),
                        "Milestone is overdue", TodoPriority.CRITICAL,
                        milestone.dueDate(), milestone.id(), null, null));
            } else {
                final long days = daysUntil(now, milestone.dueDate());
                items.add(new TodoItem("milestone-" + milestone.id(),
                        TodoItemType.UPCOMING_MILESTONE, milestone.name(),
                        "Due in " + days + (days == 1 ? " day" : " days"),
                        days <= URGENT_MILESTONE_DAYS
                                ? TodoPriority.HIGH : TodoPriority.MEDIUM,
                        milestone.dueDate(), milestone.id(), null, null));
            }
        }

        final long blocked = dashboardRepository.countBlockedInActiveRuns(
                projectId);
        if (blocked > 0) {
            items.add(new TodoItem("blocked-tests", TodoItemType.BLOCKED_TEST,
                    "Blocked tests",
                    blocked + (blocked == 1 ? " test" : " tests")
                            + " blocked in active runs",
                    TodoPriority.HIGH, null, projectId, null, blocked));
        }

        final long unreviewed = dashboardRepository
                .countFailedWithoutDefectsInActiveRuns(projectId);
        if (unreviewed > 0) {
            items.add(new TodoItem("failed-tests-review",
                    TodoItemType.FAILED_TEST_REVIEW, "Review failed tests",
                    unreviewed + (unreviewed == 1
                            ? " failed test" : " failed tests")
                            + " without linked defects",
                    TodoPriority.MEDIUM, null, projectId, null, unreviewed));
        }

        return TodoList.of(items);
    }

    /** Whole days until a moment, rounded up. */
    static long daysUntil(final Instant now, final Instant due) {
        final long millis = Duration.between(now, due).toMillis();
        final long day = Duration.ofDays(1).toMillis();
        return (millis + day - 1) / day;
    }

    private TodayCounts todayCounts(final String projectId) {
        final Map<TestResultStatus, Long> counts = new EnumMap<>(
                TestResultStatus.class);
        for (DayStatusCount row : reportRepository.dailyStatusCounts(
                projectId, startOfToday(), startOfTomorrow())) {
            counts.merge(row.status(), row.count(), Long::sum);
        }
        final StatusTally tally = StatusTally.of(counts);
        return new TodayCounts(tally.total(),
                tally.count(TestResultStatus.PASSED),
                tally.count(TestResultStatus.FAILED));
    }

    private Instant startOfToday() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC))
                .atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private Instant startOfTomorrow() {
        return startOfToday().plus(Duration.ofDays(1));
    }

    /** Results executed today. */
    private record TodayCounts(long executed, long passed, long failed) {}

}
