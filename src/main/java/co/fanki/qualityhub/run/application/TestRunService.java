package co.fanki.qualityhub.run.application;

import co.fanki.qualityhub.plan.domain.TestPlanRepository;
import co.fanki.qualityhub.run.domain.StatusTally;
import co.fanki.qualityhub.run.domain.TestResult;
import co.fanki.qualityhub.run.domain.TestResultRepository;
import co.fanki.qualityhub.run.domain.TestResultStatus;
import co.fanki.qualityhub.run.domain.TestRun;
import co.fanki.qualityhub.run.domain.TestRunRepository;
import co.fanki.qualityhub.run.domain.TestRunStatus;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.testcase.domain.TestCase;
import co.fanki.qualityhub.testcase.domain.TestCaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Application service for test runs and their results.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class TestRunService {

    private static final Logger LOG = LoggerFactory.getLogger(
            TestRunService.class);

    private final TestRunRepository runRepository;
    private final TestResultRepository resultRepository;
    private final TestCaseRepository caseRepository;
    private final TestPlanRepository planRepository;

    /**
     * Creates a new TestRunService.
     *
     * @param theRunRepository the run repository
     * @param theResultRepository the result repository
     * @param theCaseRepository the test case repository
     * @param thePlanRepository the test plan repository
     */
    public TestRunService(final TestRunRepository theRunRepository,
            final TestResultRepository theResultRepository,
            final TestCaseRepository theCaseRepository,
            final TestPlanRepository thePlanRepository) {
        this.runRepository = theRunRepository;
        this.resultRepository = theResultRepository;
        this.caseRepository = theCaseRepository;
        this.planRepository = thePlanRepository;
    }

    /**
     * Creates a run that has not started yet.
     *
     * @param projectId the project ID
     * @param planId the plan it executes, may be null
     * @param name the name
     * @param description the description
     * @param config the configuration
     * @param assigneeId the assignee
     * @return the created run
     * @throws DomainException if the plan is not in the project
     */
    @Transactional
    public TestRun create(final String projectId, final String planId,
            final String name, final String description,
            final Map<String, Object> config, final String assigneeId) {
        if (planId != null
                && planRepository.findById(projectId, planId).isEmpty()) {
            throw DomainException.notFound("Test plan", planId);
        }
        final TestRun run = TestRun.create(projectId, planId, name,
                description, config, assigneeId);
        runRepository.save(run);
        LOG.info("Test run created with ID: {}", run.id());
        return run;
    }

    public List<TestRun> findByProject(final String projectId) {
        return runRepository.findByProject(projectId);
    }

    /**
     * Finds a live run of a project, throwing if not found.
     *
     * @param projectId the project ID
     * @param runId the run ID
     * @return the run
     */
    public TestRun getById(final String projectId, final String runId) {
        return runRepository.findById(projectId, runId)
                .orElseThrow(() -> DomainException.notFound(
                        "Test run", runId));
    }

    @Transactional
    public TestRun update(final String projectId, final String runId,
            final String name, final String description,
            final Map<String, Object> config, final String assigneeId,
            final TestRunStatus status) {
        final TestRun run = getById(projectId, runId);
        run.update(name, description, config, assigneeId, status);
        runRepository.update(run);
        LOG.info("Updated test run {}", runId);
        return run;
    }

    @Transactional
    public void delete(final String projectId, final String runId) {
        getById(projectId, runId);
        runRepository.softDelete(runId);
        LOG.info("Deleted test run {}", runId);
    }

    @Transactional
    public TestRun start(final String projectId, final String runId) {
        final TestRun run = getById(projectId, runId);
        run.start();
        runRepository.update(run);
        LOG.info("Started test run {}", runId);
        return run;
    }

    @Transactional
    public TestRun complete(final String projectId, final String runId) {
        final TestRun run = getById(projectId, runId);
        run.complete();
        runRepository.update(run);
        LOG.info("Completed test run {}", runId);
        return run;
    }

    @Transactional
    public TestRun close(final String projectId, final String runId) {
        final TestRun run = getById(projectId, runId);
        run.close();
        runRepository.update(run);
        LOG.info("Closed test run {}", runId);
        return run;
    }

    /**
     * Reports how much of a run has been executed.
     *
     * @param projectId the project ID
     * @param runId the run ID
     * @return the progress
     */
    public RunProgress progress(final String projectId, final String runId) {
        final TestRun run = getById(projectId, runId);
        final StatusTally tally = resultRepository.tally(runId);
        return new RunProgress(runId, tally.total(), tally.executed(),
                tally.count(TestResultStatus.UNTESTED),
                tally.progressPercentage(), run.status());
    }

    /**
     * Tallies the results of a run.
     *
     * @param projectId the project ID
     * @param runId the run ID
     * @return the statistics
     */
    public RunStatistics statistics(final String projectId,
            final String runId) {
        getById(projectId, runId);
        final StatusTally tally = resultRepository.tally(runId);
        return new RunStatistics(tally.total(),
                tally.count(TestResultStatus.PASSED),
                tally.count(TestResultStatus.FAILED),
                tally.count(TestResultStatus.BLOCKED),
                tally.count(TestResultStatus.SKIPPED),
                tally.count(TestResultStatus.RETEST),
                tally.count(TestResultStatus.UNTESTED),
                tally.passRate());
    }

    public List<TestResult> results(final String projectId,
            final String runId) {
        getById(projectId, runId);
        return resultRepository.findByRun(runId);
    }

    /**
     * Finds a result of a run, throwing if not found.
     *
     * @param projectId the project ID
     * @param runId the run ID
     * @param resultId the result ID
     * @return the result
     */
    public TestResult getResult(final String projectId, final String runId,
            final String resultId) {
        getById(projectId, runId);
        return resultRepository.findById(runId, resultId)
                .orElseThrow(() -> DomainException.notFound(
                        "Test result", resultId));
    }

    /**
     * Records the result of a case in a run, pinned to the case's current
     * version.
     *
     * @param projectId the project ID
     * @param runId the run ID
     * @param caseId the case ID
     * @param status the outcome
     * @param comment the comment
     * @param elapsedSeconds time spent
     * @param defects linked defects
     * @param userId the recording user
     * @return the new result
     * @throws DomainException if the case already has a result in the run
     */
    @Transactional
    public TestResult addResult(final String projectId, final String runId,
            final String caseId, final TestResultStatus status,
            final String comment, final Integer elapsedSeconds,
            final List<String> defects, final String userId) {
        getById(projectId, runId);
        final TestCase testCase = caseRepository.findById(projectId, caseId)
                .orElseThrow(() -> DomainException.notFound(
                        "Test case", caseId));

        if (resultRepository.exists(runId, caseId)) {
            throw new DomainException("Result for test case " + caseId
                    + " already exists in this run",
                    "TEST_RESULT_ALREADY_EXISTS");
        }

        final TestResult result = TestResult.record(runId, caseId,
                testCase.version(), status, comment, elapsedSeconds, defects,
                userId);
        resultRepository.save(result);
        LOG.info("Recorded {} for test case {} in run {}", result.status(),
                caseId, runId);
        return result;
    }

    /**
     * Adds untested results for several cases, skipping the ones that
     * already have a result.
     *
     * @param projectId the project ID
     * @param runId the run ID
     * @param caseIds the case IDs
     * @return the new results, empty when every case was present
     */
    @Transactional
    public List<TestResult> addResults(final String projectId,
            final String runId, final List<String> caseIds) {
        getById(projectId, runId);

        final Set<String> candidates = new LinkedHashSet<>(caseIds);
        candidates.removeAll(resultRepository.caseIdsIn(runId, candidates));

        final List<TestCase> cases = caseRepository.findByIds(projectId,
                candidates);
        if (cases.size() != candidates.size()) {
            cases.forEach(found -> candidates.remove(found.id()));
            throw DomainException.notFound("Test case",
                    String.join(", ", candidates));
        }

        final List<TestResult> added = new ArrayList<>(cases.size());
        for (TestCase testCase : cases) {
            final TestResult result = TestResult.pending(runId,
                    testCase.id(), testCase.version());
            resultRepository.save(result);
            added.add(result);
        }
        LOG.info("Added {} pending results to run {}", added.size(), runId);
        return added;
    }

    @Transactional
    public TestResult updateResult(final String projectId, final String runId,
            final String resultId, final TestResultStatus status,
            final String comment, final Integer elapsedSeconds,
            final List<String> defects, final String userId) {
        final TestResult result = getResult(projectId, runId, resultId);
        result.update(status, comment, elapsedSeconds, defects, userId);
        resultRepository.update(result);
        LOG.info("Updated result {} of run {}", resultId, runId);
        return result;
    }

    @Transactional
    public void deleteResult(final String projectId, final String runId,
            final String resultId) {
        final TestResult result = getResult(projectId, runId, resultId);
        resultRepository.delete(result.id());
        LOG.info("Deleted result {} of run {}", resultId, runId);
    }

    /**
     * Execution progress of a run.
     *
     * @param testRunId the run ID
     * @param total all results
     * @param executed results no longer untested
     * @param remaining untested results
     * @param progressPercentage executed over total, rounded
     * @param status the run status
     */
    public record RunProgress(
            String testRunId,
            long total,
            long executed,
            long remaining,
            int progressPercentage,
            TestRunStatus status
    ) {}

    /**
     * Result tally of a run.
     *
     * @param total all results
     * @param passed passed results
     * @param failed failed results
     * @param blocked blocked results
     * @param skipped skipped results
     * @param retest results to retest
     * @param untested untested results
     * @param passRate passed over executed, rounded
     */
    public record RunStatistics(
            long total,
            long passed,
            long failed,
            long blocked,
            long skipped,
            long retest,
            long untested,
            int passRate
    ) {}

}
