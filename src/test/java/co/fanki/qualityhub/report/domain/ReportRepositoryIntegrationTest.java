package co.fanki.qualityhub.report.domain;

import co.fanki.qualityhub.organization.domain.Organization;
import co.fanki.qualityhub.organization.domain.OrganizationPlan;
import co.fanki.qualityhub.organization.domain.OrganizationRepository;
import co.fanki.qualityhub.organization.domain.OrganizationSlug;
import co.fanki.qualityhub.project.domain.Project;
import co.fanki.qualityhub.project.domain.ProjectRepository;
import co.fanki.qualityhub.report.domain.ReportRepository.DayStatusCount;
import co.fanki.qualityhub.run.domain.TestResult;
import co.fanki.qualityhub.run.domain.TestResultRepository;
import co.fanki.qualityhub.run.domain.TestResultStatus;
import co.fanki.qualityhub.run.domain.TestRun;
import co.fanki.qualityhub.run.domain.TestRunRepository;
import co.fanki.qualityhub.run.domain.TestRunStatus;
import co.fanki.qualityhub.testcase.domain.TestCase;
import co.fanki.qualityhub.testcase.domain.TestCaseDetails;
import co.fanki.qualityhub.testcase.domain.TestCaseRepository;

import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Integration tests for ReportRepository using TestContainers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class ReportRepositoryIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:14")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(final DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final Instant FROM = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2026-01-03T00:00:00Z");

    @Autowired
    private Jdbi jdbi;

    private ReportRepository repository;

    private TestCaseRepository testCaseRepository;

    private TestResultRepository testResultRepository;

    private TestRunRepository testRunRepository;

    private Project project;

    @BeforeEach
    void setUp() {
        repository = new ReportRepository(jdbi);
        testCaseRepository = new TestCaseRepository(jdbi);
        testResultRepository = new TestResultRepository(jdbi);
        testRunRepository = new TestRunRepository(jdbi);
        jdbi.useHandle(handle -> handle.execute("DELETE FROM organizations"));

        final Organization organization = Organization.create("Acme",
                OrganizationSlug.of("acme"), OrganizationPlan.FREE, null);
        new OrganizationRepository(jdbi).save(organization);
        project = Project.create(organization.id(), "Checkout", null, null);
        new ProjectRepository(jdbi).save(project);
    }

    @Test
    void whenCountingDaily_givenResultsAroundBounds_shouldBucketByUtcDay() {
        final TestRun run = createRun();
        executeAt(run, TestResultStatus.PASSED, "2025-12-31T23:59:59Z");
        executeAt(run, TestResultStatus.PASSED, "2026-01-01T00:00:00Z");
        executeAt(run, TestResultStatus.FAILED, "2026-01-01T23:59:59Z");
        executeAt(run, TestResultStatus.PASSED, "2026-01-02T00:00:00Z");
        executeAt(run, TestResultStatus.PASSED, "2026-01-02T23:30:00Z");
        executeAt(run, TestResultStatus.PASSED, "2026-01-03T00:00:00Z");

        final List<DayStatusCount> counts = repository.dailyStatusCounts(
                project.id(), FROM, TO);

        assertEquals(List.of(
                new DayStatusCount(LocalDate.of(2026, 1, 1),
                        TestResultStatus.FAILED, 1),
                new DayStatusCount(LocalDate.of(2026, 1, 1),
                        TestResultStatus.PASSED, 1),
                new DayStatusCount(LocalDate.of(2026, 1, 2),
                        TestResultStatus.PASSED, 2)),
                counts.stream()
                        .sorted(Comparator.comparing(DayStatusCount::day)
                                .thenComparing(row -> row.status().value()))
                        .toList());
    }

    @Test
    void whenCountingDaily_givenDeletedRun_shouldSkipItsResults() {
        final TestRun live = createRun();
        final TestRun deleted = createRun();
        executeAt(live, TestResultStatus.PASSED, "2026-01-01T10:00:00Z");
        executeAt(deleted, TestResultStatus.PASSED, "2026-01-01T11:00:00Z");
        testRunRepository.softDelete(deleted.id());

        final List<DayStatusCount> counts = repository.dailyStatusCounts(
                project.id(), FROM, TO);

        assertEquals(1, counts.size());
        assertEquals(1, counts.get(0).count());
    }

    @Test
    void whenCountingPerTester_givenResultAtUpperBound_shouldExcludeIt() {
        final TestRun run = createRun();
        executeAt(run, TestResultStatus.PASSED, "2026-01-02T23:59:59Z");
        executeAt(run, TestResultStatus.PASSED, "2026-01-03T00:00:00Z");

        final long total = repository.testerStatusCounts(project.id(), FROM,
                TO).stream()
                .mapToLong(ReportRepository.TesterStatusCount::count)
                .sum();

        assertEquals(1, total);
    }

    private TestRun createRun() {
        final TestRun run = TestRun.reconstitute(UUID.randomUUID().toString(),
                project.id(), null, "Regression", null,
                TestRunStatus.IN_PROGRESS, null, null,
                Instant.parse("2025-12-30T00:00:00Z"), null,
                Instant.parse("2025-12-30T00:00:00Z"),
                Instant.parse("2025-12-30T00:00:00Z"));
        testRunRepository.save(run);
        return run;
    }

    private void executeAt(final TestRun run, final TestResultStatus status,
            final String executedAt) {
        final TestCase testCase = TestCase.create(project.id(),
                new TestCaseDetails(null, "Case at " + executedAt, null, null,
                        null, null, null, null, null), null);
        testCaseRepository.save(testCase);
        final Instant at = Instant.parse(executedAt);
        testResultRepository.save(TestResult.reconstitute(
                UUID.randomUUID().toString(), run.id(), testCase.id(), 1,
                status, null, null, null, null, at, at, at));
    }

}
