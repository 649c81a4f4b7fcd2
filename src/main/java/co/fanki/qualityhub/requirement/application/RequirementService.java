package co.fanki.qualityhub.requirement.application;

import co.fanki.qualityhub.requirement.domain.CoverageStatistics;
import co.fanki.qualityhub.requirement.domain.Requirement;
import co.fanki.qualityhub.requirement.domain.RequirementCoverage;
import co.fanki.qualityhub.requirement.domain.RequirementCoverageRepository;
import co.fanki.qualityhub.requirement.domain.RequirementRepository;
import co.fanki.qualityhub.requirement.domain.RequirementSource;
import co.fanki.qualityhub.requirement.domain.RequirementStatus;
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
 * Application service for requirements and their test coverage.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class RequirementService {

    private static final Logger LOG = LoggerFactory.getLogger(
            RequirementService.class);

    private final RequirementRepository requirementRepository;
    private final RequirementCoverageRepository coverageRepository;
    private final TestCaseRepository caseRepository;

    /**
     * Creates a new RequirementService.
     *
     * @param theRequirementRepository the requirement repository
     * @param theCoverageRepository the coverage repository
     * @param theCaseRepository the test case repository
     */
    public RequirementService(
            final RequirementRepository theRequirementRepository,
            final RequirementCoverageRepository theCoverageRepository,
            final TestCaseRepository theCaseRepository) {
        this.requirementRepository = theRequirementRepository;
        this.coverageRepository = theCoverageRepository;
        this.caseRepository = theCaseRepository;
    }

    @Transactional
    public Requirement create(final String projectId, final String externalId,
            final String title, final String description,
            final RequirementSource source, final RequirementStatus status,
            final Map<String, Object> customFields, final String userId) {
        final Requirement requirement = Requirement.create(projectId,
                externalId, title, description, source, status, customFields,
                userId);
        requirementRepository.save(requirement);
        LOG.info("Requirement created with ID: {}", requirement.id());
        return requirement;
    }

    public List<Requirement> findByProject(final String projectId) {
        return requirementRepository.findByProject(projectId);
    }

    /**
     * Finds a live requirement of a project, throwing if not found.
     *
     * @param projectId the project ID
     * @param requirementId the requirement ID
     * @return the requirement
     */
    public Requirement getById(final String projectId,
            final String requirementId) {
        return requirementRepository.findById(projectId, requirementId)
                .orElseThrow(() -> DomainException.notFound(
                        "Requirement", requirementId));
    }

    @Transactional
    public Requirement update(final String projectId,
            final String requirementId, final String externalId,
            final String title, final String description,
            final RequirementSource source, final RequirementStatus status,
            final Map<String, Object> customFields) {
        final Requirement requirement = getById(projectId, requirementId);
        requirement.update(externalId, title, description, source, status,
                customFields);
        requirementRepository.update(requirement);
        LOG.info("Updated requirement {}", requirementId);
        return requirement;
    }

    @Transactional
    public void delete(final String projectId, final String requirementId) {
        getById(projectId, requirementId);
        requirementRepository.softDelete(requirementId);
        LOG.info("Deleted requirement {}", requirementId);
    }

    public List<RequirementCoverage> coverage(final String projectId,
            final String requirementId) {
        getById(projectId, requirementId);
        return coverageRepository.findByRequirement(requirementId);
    }

    /**
     * Links test cases to a requirement. Cases already linked are skipped.
     *
     * @param projectId the project ID
     * @param requirementId the requirement ID
     * @param caseIds the case IDs
     * @param userId the linking user
     * @return the new links only
     * @throws DomainException if a case is not in the project
     */
    @Transactional
    public List<RequirementCoverage> addCoverage(final String projectId,
            final String requirementId, final List<String> caseIds,
            final String userId) {
        getById(projectId, requirementId);

        final Set<String> candidates = new LinkedHashSet<>(caseIds);
        candidates.removeAll(coverageRepository.caseIdsIn(requirementId,
                candidates));

        final List<TestCase> cases = caseRepository.findByIds(projectId,
                candidates);
        if (cases.size() != candidates.size()) {
            cases.forEach(found -> candidates.remove(found.id()));
            throw DomainException.notFound("Test case",
                    String.join(", ", candidates));
        }

        final List<RequirementCoverage> added = new ArrayList<>();
        for (String caseId : candidates) {
            final RequirementCoverage link = RequirementCoverage.link(
                    requirementId, caseId, userId);
            coverageRepository.save(link);
            added.add(link);
        }
        LOG.info("Linked {} test cases to requirement {}", added.size(),
                requirementId);
        return added;
    }

    /**
     * Unlinks a test case from a requirement.
     *
     * @param projectId the project ID
     * @param requirementId the requirement ID
     * @param caseId the case ID
     * @throws DomainException if the case is not linked
     */
    @Transactional
    public void removeCoverage(final String projectId,
            final String requirementId, final String caseId) {
        getById(projectId, requirementId);
        if (!coverageRepository.delete(requirementId, caseId)) {
            throw new DomainException("Coverage for test case " + caseId
                    + " not found in requirement " + requirementId,
                    "COVERAGE_NOT_FOUND");
        }
        LOG.info("Unlinked test case {} from requirement {}", caseId,
                requirementId);
    }

    /**
     * Counts the cases linked to one requirement.
     *
     * @param projectId the project ID
     * @param requirementId the requirement ID
     * @return the statistics
     */
    public RequirementStatistics statistics(final String projectId,
            final String requirementId) {
        getById(projectId, requirementId);
        return new RequirementStatistics(requirementId,
                coverageRepository.countByRequirement(requirementId));
    }

    /**
     * Computes how much of a project's requirements are covered. A project
     * without requirements answers all zeros without touching the coverage
     * table.
     *
     * @param projectId the project ID
     * @return the statistics
     */
    public CoverageStatistics projectStatistics(final String projectId) {
        final long total = requirementRepository.countByProject(projectId);
        if (total == 0) {
            return CoverageStatistics.empty();
        }
        return CoverageStatistics.of(total,
                coverageRepository.countCoveredRequirements(projectId));
    }

    /**
     * Coverage of one requirement.
     *
     * @param requirementId the requirement ID
     * @param totalTestCases linked test cases
     */
    public record RequirementStatistics(
            String requirementId,
            long totalTestCases
    ) {}

}
