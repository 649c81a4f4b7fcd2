package co.fanki.qualityhub.testcase.application;

import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.suite.domain.SectionRepository;
import co.fanki.qualityhub.testcase.domain.TestCase;
import co.fanki.qualityhub.testcase.domain.TestCaseDetails;
import co.fanki.qualityhub.testcase.domain.TestCasePriority;
import co.fanki.qualityhub.testcase.domain.TestCaseRepository;
import co.fanki.qualityhub.testcase.domain.TestCaseVersion;
import co.fanki.qualityhub.testcase.domain.TestCaseVersionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Application service for test cases and their version history.
 *
 * <p>Every write that changes a case stores a snapshot of the resulting
 * version in the same transaction. Two writers racing on the same version
 * are told apart by the guarded update: the loser gets a
 * {@code TEST_CASE_VERSION_CONFLICT}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class TestCaseService {

    private static final Logger LOG = LoggerFactory.getLogger(
            TestCaseService.class);

    private final TestCaseRepository caseRepository;
    private final TestCaseVersionRepository versionRepository;
    private final SectionRepository sectionRepository;

    /**
     * Creates a new TestCaseService.
     *
     * @param theCaseRepository the test case repository
     * @param theVersionRepository the version snapshot repository
     * @param theSectionRepository the section repository
     */
    public TestCaseService(final TestCaseRepository theCaseRepository,
            final TestCaseVersionRepository theVersionRepository,
            final SectionRepository theSectionRepository) {
        this.caseRepository = theCaseRepository;
        this.versionRepository = theVersionRepository;
        this.sectionRepository = theSectionRepository;
    }

    /**
     * Creates a test case at version 1 and stores its first snapshot.
     *
     * @param projectId the project ID
     * @param details the content
     * @param userId the creating user
     * @return the created case
     * @throws DomainException if the section is not in the project
     */
    @Transactional
    public TestCase create(final String projectId,
            final TestCaseDetails details, final String userId) {
        requireSection(projectId, details.sectionId());

        final TestCase testCase = TestCase.create(projectId, details, userId);
        caseRepository.save(testCase);
        versionRepository.save(TestCaseVersion.of(testCase, userId));

        LOG.info("Test case created with ID: {}", testCase.id());
        return testCase;
    }

    /**
     * Lists the live cases of a project.
     *
     * @param projectId the project ID
     * @param sectionId only cases in this section, may be null
     * @param priority only cases with this priority, may be null
     * @return the cases
     */
    public List<TestCase> findByProject(final String projectId,
            final String sectionId, final TestCasePriority priority) {
        return caseRepository.findByProject(projectId, sectionId, priority);
    }

    /**
     * Finds a live case, throwing if not found.
     *
     * @param projectId the project ID
     * @param caseId the case ID
     * @return the case
     * @throws DomainException if not found or deleted
     */
    public TestCase getById(final String projectId, final String caseId) {
        return caseRepository.findById(projectId, caseId)
                .orElseThrow(() -> DomainException.notFound(
                        "Test case", caseId));
    }

    /**
     * Updates a case, bumping its version and storing a snapshot.
     *
     * @param projectId the project ID
     * @param caseId the case ID
     * @param details the changes, null fields are left untouched
     * @param expectedVersion the version the caller edited, null to skip
     * the check
     * @param userId the user making the change
     * @return the updated case
     * @throws DomainException if not found, or if another change landed
     * first
     */
    @Transactional
    public TestCase update(final String projectId, final String caseId,
            final TestCaseDetails details, final Integer expectedVersion,
            final String userId) {
        final TestCase testCase = getById(projectId, caseId);
        if (expectedVersion != null && expectedVersion != testCase.version()) {
            throw versionConflict(caseId);
        }
        requireSection(projectId, details.sectionId());

        final int loadedVersion = testCase.version();
        testCase.update(details);
        store(testCase, loadedVersion, userId);

        LOG.info("Updated test case {} to version {}", caseId,
                testCase.version());
        return testCase;
    }

    /**
     * Soft deletes a case.
     *
     * @param projectId the project ID
     * @param caseId the case ID
     */
    @Transactional
    public void delete(final String projectId, final String caseId) {
        if (caseRepository.softDelete(projectId, List.of(caseId)) == 0) {
            throw DomainException.notFound("Test case", caseId);
        }
        LOG.info("Deleted test case {}", caseId);
    }

    /**
     * Returns the version history of a case, newest first.
     *
     * @param projectId the project ID
     * @param caseId the case ID
     * @return the snapshots
     */
    public List<TestCaseVersion> history(final String projectId,
            final String caseId) {
        getById(projectId, caseId);
        return versionRepository.findByCase(caseId);
    }

    /**
     * Creates several cases in one transaction.
     *
     * @param projectId the project ID
     * @param details the content of each case
     * @param userId the creating user
     * @return the created cases, in input order
     */
    @Transactional
    public List<TestCase> bulkCreate(final String projectId,
            final List<TestCaseDetails> details, final String userId) {
        final List<TestCase> created = new ArrayList<>(details.size());
        for (TestCaseDetails each : details) {
            created.add(create(projectId, each, userId));
        }
        LOG.info("Bulk created {} test cases in project {}", created.size(),
                projectId);
        return created;
    }

    /**
     * Updates several cases in one transaction. One missing case rolls back
     * the whole batch.
     *
     * @param projectId the project ID
     * @param changes the changes per case
     * @param userId the user making the change
     * @return the updated cases, in input order
     */
    @Transactional
    public List<TestCase> bulkUpdate(final String projectId,
            final List<CaseChange> changes, final String userId) {
        final List<TestCase> updated = new ArrayList<>(changes.size());
        for (CaseChange change : changes) {
            updated.add(update(projectId, change.caseId(), change.details(),
                    null, userId));
        }
        LOG.info("Bulk updated {} test cases in project {}", updated.size(),
                projectId);
        return updated;
    }

    /**
     * Soft deletes several cases.
     *
     * @param projectId the project ID
     * @param caseIds the case IDs
     * @return how many cases were deleted
     */
    @Transactional
    public int bulkDelete(final String projectId, final List<String> caseIds) {
        final int deleted = caseRepository.softDelete(projectId,
                new LinkedHashSet<>(caseIds));
        LOG.info("Bulk deleted {} test cases in project {}", deleted,
                projectId);
        return deleted;
    }

    /**
     * Files several cases under one section, or under none.
     *
     * @param projectId the project ID
     * @param caseIds the case IDs
     * @param sectionId the target section, null to detach them
     * @param userId the user making the change
     * @return the moved cases
     * @throws DomainException if a case or the section is not in the
     * project
     */
    @Transactional
    public List<TestCase> bulkMove(final String projectId,
            final List<String> caseIds, final String sectionId,
            final String userId) {
        requireSection(projectId, sectionId);

        final Set<String> ids = new LinkedHashSet<>(caseIds);
        final List<TestCase> cases = caseRepository.findByIds(projectId, ids);
        if (cases.size() != ids.size()) {
            final Set<String> missing = new LinkedHashSet<>(ids);
            cases.forEach(found -> missing.remove(found.id()));
            throw DomainException.notFound("Test case",
                    String.join(", ", missing));
        }

        for (TestCase testCase : cases) {
            final int loadedVersion = testCase.version();
            testCase.moveTo(sectionId);
            store(testCase, loadedVersion, userId);
        }
        LOG.info("Moved {} test cases to section {}", cases.size(),
                sectionId);
        return cases;
    }

    private void store(final TestCase testCase, final int loadedVersion,
            final String userId) {
        if (!caseRepository.update(testCase, loadedVersion)) {
            throw versionConflict(testCase.id());
        }
        versionRepository.save(TestCaseVersion.of(testCase, userId));
    }

    private void requireSection(final String projectId,
            final String sectionId) {
        if (sectionId != null
                && !sectionRepository.existsInProject(projectId, sectionId)) {
            throw DomainException.notFound("Section", sectionId);
        }
    }

    private DomainException versionConflict(final String caseId) {
        LOG.warn("Concurrent change detected on test case {}", caseId);
        return new DomainException("Test case " + caseId
                + " was modified by another request",
                "TEST_CASE_VERSION_CONFLICT");
    }

    /**
     * A change to one case inside a bulk update.
     *
     * @param caseId the case ID
     * @param details the changes
     */
    public record CaseChange(String caseId, TestCaseDetails details) {
    }

}
