package co.fanki.qualityhub.dashboard.domain;

import co.fanki.qualityhub.dashboard.domain.DashboardRepository.MilestoneMark;
import co.fanki.qualityhub.dashboard.domain.DashboardRepository.RunProgress;
import co.fanki.qualityhub.milestone.domain.Milestone;
import co.fanki.qualityhub.milestone.domain.MilestoneRepository;
import co.fanki.qualityhub.organization.domain.Organization;
import co.fanki.qualityhub.organization.domain.OrganizationPlan;
import co.fanki.qualityhub.organization.domain.OrganizationRepository;
import co.fanki.qualityhub.organization.domain.OrganizationSlug;
import co.fanki.qualityhub.project.domain.Project;
import co.fanki.qualityhub.project.domain.ProjectRepository;
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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for DashboardRepository using TestContainers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class DashboardRepositoryIntegrationTest {

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

    @Autowired
    private Jdbi jdbi;

    private DashboardRepository repository;

    private TestCaseRepository testCaseRepository;

    private TestRunRepository testRunRepository;

    private TestResultRepository testResultRepository;

    private Project project;

    @BeforeEach
    void setUp() {
        repository = new DashboardRepository(jdbi);
        testCaseRepository = new TestCaseRepository(jdbi);
        testRunRepository = new TestRunRepository(jdbi);
        testResultRepository = new TestResultRepository(jdbi);
        jdbi.useHandle(handle -> handle.execute("DELETE FROM organizations"));

        final Organization organization = Organization.create("Acme",
                OrganizationSlug.of("acme"), OrganizationPlan.FREE, null);
        new OrganizationRepository(jdbi).save(organization);
        project = Project.create(organization.id(), "Checkout", null, null);
        new ProjectRepository(jdbi).save(project);
    }

    @Test
    void whenListingActiveRuns_givenMixedResults_shouldCountExecuted() {
        final TestRun active = createRun("Smoke");
        active.start();
        testRunRepository.update(active);
        createRun("Pending");

        record(active, TestResultStatus.PASSED, null);
        record(active, TestResultStatus.FAILED, null);
        record(active, TestResultStatus.UNTESTED, null);

        final List<RunProgress> runs = repository.activeRuns(project.id(), 5);

        assertEquals(1, runs.size());
        assertEquals("Smoke", runs.get(0).name());
        assertEquals(TestRunStatus.IN_PROGRESS, runs.get(0).status());
        assertEquals(3, runs.get(0).totalResults());
        assertEquals(2, runs.get(0).executedResults());
        assertEquals(2, repository.openRuns(project.id(), null, 50).size());
    }

    @Test
    void whenCountingActiveRunResults_givenDefects_shouldSplitFailures() {
        final TestRun active = createRun("Smoke");
        active.start();
        testRunRepository.update(active);

        record(active, TestResultStatus.FAILED, List.of("BUG-1"));
        record(active, TestResultStatus.FAILED, List.of());
        record(active, TestResultStatus.FAILED, null);
        record(active, TestResultStatus.BLOCKED, null);

        assertEquals(2, repository.countFailedWithoutDefectsInActiveRuns(
                project.id()));
        assertEquals(1, repository.countBlockedInActiveRuns(project.id()));
    }

    @Test
    void whenListingMilestonesDue_givenCompletedAndLater_shouldSkipThem() {
        final Instant now = Instant.now();
        final MilestoneRepository milestones = new MilestoneRepository(jdbi);
        final Milestone overdue = Milestone.create(project.id(), "Alpha", null,
                now.minus(Duration.ofDays(1)));
        final Milestone done = Milestone.create(project.id(), "Beta", null,
                now.plus(Duration.ofDays(1)));
        done.update(null, null, null, true);
        final Milestone later = Milestone.create(project.id(), "GA", null,
                now.plus(Duration.ofDays(30)));
        milestones.save(overdue);
        milestones.save(done);
        milestones.save(later);

        final List<MilestoneMark> due = repository.milestonesDueBefore(
                project.id(), now.plus(Duration.ofDays(7)));

        assertEquals(1, due.size());
        assertEquals("Alpha", due.get(0).name());
        assertTrue(repository.completedMilestones(project.id(), 5).stream()
                .anyMatch(mark -> mark.name().equals("Beta")));
    }

    private TestRun createRun(final String name) {
        final TestRun run = TestRun.create(project.id(), null, name, null,
                null, null);
        testRunRepository.save(run);
        return run;
    }

    private void record(final TestRun run, final TestResultStatus status,
            final List<String> defects) {
        final TestCase testCase = TestCase.create(project.id(),
                new TestCaseDetails(null, "Case " + status.value(), null,
                        null, null, null, null, null, null), null);
        testCaseRepository.save(testCase);
        testResultRepository.save(TestResult.record(run.id(), testCase.id(),
                1, status, null, null, defects, null));
    }

}
