package co.fanki.qualityhub.plan.application;

import co.fanki.qualityhub.milestone.domain.Milestone;
import co.fanki.qualityhub.milestone.domain.MilestoneRepository;
import co.fanki.qualityhub.plan.domain.TestPlan;
import co.fanki.qualityhub.plan.domain.TestPlanEntry;
import co.fanki.qualityhub.plan.domain.TestPlanEntryRepository;
import co.fanki.qualityhub.plan.domain.TestPlanRepository;
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
import java.util.Optional;
import java.util.Set;

/**
 * Application service for test plans and their entries.
 *
 * <p>New entries are appended after the highest position unless the caller
 * picks one. A case appears at most once per plan.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class TestPlanService {

    private static final Logger LOG = LoggerFactory.getLogger(
            TestPlanService.class);

    private final TestPlanRepository planRepository;
    private final TestPlanEntryRepository entryRepository;
    private final MilestoneRepository milestoneRepository;
    private final TestCaseRepository caseRepository;

    /**
     * Creates a new TestPlanService.
     *
     * @param thePlanRepository the plan repository
     * @param theEntryRepository the entry repository
     * @param theMilestoneRepository the milestone repository
     * @param theCaseRepository the test case repository
     */
    public TestPlanService(final TestPlanRepository thePlanRepository,
            final TestPlanEntryRepository theEntryRepository,
            final MilestoneRepository theMilestoneRepository,
            final TestCaseRepository theCaseRepository) {
        this.planRepository = thePlanRepository;
        this.entryRepository = theEntryRepository;
        this.milestoneRepository = theMilestoneRepository;
        this.caseRepository = theCaseRepository;
    }

    @Transactional
    public TestPlan create(final String projectId, final String milestoneId,
            final String name, final String description) {
        requireMilestone(projectId, milestoneId);
        final TestPlan plan = TestPlan.create(projectId, milestoneId, name,
                description);
        planRepository.save(plan);
        LOG.info("Test plan created with ID: {}", plan.id());
        return plan;
    }

    public List<TestPlan> findByProject(final String projectId) {
        return planRepository.findByProject(projectId);
    }

    /**
     * Finds a live plan of a project, throwing if not found.
     *
     * @param projectId the project ID
     * @param planId the plan ID
     * @return the plan
     */
    public TestPlan getById(final String projectId, final String planId) {
        return planRepository.findById(projectId, planId)
                .orElseThrow(() -> DomainException.notFound(
                        "Test plan", planId));
    }

    @Transactional
    public TestPlan update(final String projectId, final String planId,
            final String milestoneId, final String name,
            final String description) {
        final TestPlan plan = getById(projectId, planId);
        requireMilestone(projectId, milestoneId);
        plan.update(milestoneId, name, description);
        planRepository.update(plan);
        LOG.info("Updated test plan {}", planId);
        return plan;
    }

    @Transactional
    public void delete(final String projectId, final String planId) {
        getById(projectId, planId);
        planRepository.softDelete(planId);
        LOG.info("Deleted test plan {}", planId);
    }

    /**
     * Returns the milestone a plan is aimed at.
     *
     * @param projectId the project ID
     * @param planId the plan ID
     * @return the milestone, empty when the plan has none
     */
    public Optional<Milestone> milestone(final String projectId,
            final String planId) {
        final TestPlan plan = getById(projectId, planId);
        if (plan.milestoneId() == null) {
            return Optional.empty();
        }
        return milestoneRepository.findById(projectId, plan.milestoneId());
    }

    public List<TestPlanEntry> entries(final String projectId,
            final String planId) {
        getById(projectId, planId);
        return entryRepository.findByPlan(planId);
    }

    /**
     * Adds a case to a plan.
     *
     * @param projectId the project ID
     * @param planId the plan ID
     * @param caseId the case ID
     * @param position the position, null to append
     * @return the new entry
     * @throws DomainException if the case is already in the plan
     */
    @Transactional
    public TestPlanEntry addEntry(final String projectId, final String planId,
            final String caseId, final Integer position) {
        getById(projectId, planId);
        caseRepository.findById(projectId, caseId)
                .orElseThrow(() -> DomainException.notFound(
                        "Test case", caseId));

        if (entryRepository.exists(planId, caseId)) {
            throw new DomainException("Test case " + caseId
                    + " is already in this test plan",
                    "TEST_PLAN_ENTRY_ALREADY_EXISTS");
        }

        final int target = position != null
                ? position : entryRepository.maxPosition(planId) + 1;
        final TestPlanEntry entry = TestPlanEntry.create(planId, caseId,
                target);
        entryRepository.save(entry);
        LOG.info("Added test case {} to plan {} at {}", caseId, planId,
                target);
        return entry;
    }

    /**
     * Appends several cases to a plan, skipping the ones already in it.
     *
     * @param projectId the project ID
     * @param planId the plan ID
     * @param caseIds the case IDs
     * @return the new entries, empty when every case was present
     */
    @Transactional
    public List<TestPlanEntry> addEntries(final String projectId,
            final String planId, final List<String> caseIds) {
        getById(projectId, planId);

        final Set<String> candidates = new LinkedHashSet<>(caseIds);
        final List<TestCase> found = caseRepository.findByIds(projectId,
                candidates);
        if (found.size() != candidates.size()) {
            found.forEach(testCase -> candidates.remove(testCase.id()));
            throw DomainException.notFound("Test case",
                    String.join(", ", candidates));
        }

        candidates.removeAll(entryRepository.caseIdsIn(planId, candidates));
        final List<TestPlanEntry> added = new ArrayList<>(candidates.size());
        if (candidates.isEmpty()) {
            return added;
        }

        int position = entryRepository.maxPosition(planId) + 1;
        for (String caseId : candidates) {
            final TestPlanEntry entry = TestPlanEntry.create(planId, caseId,
                    position++);
            entryRepository.save(entry);
            added.add(entry);
        }
        LOG.info("Added {} test cases to plan {}", added.size(), planId);
        return added;
    }

    @Transactional
    public TestPlanEntry updateEntry(final String projectId,
            final String planId, final String entryId, final int position) {
        final TestPlanEntry entry = getEntry(projectId, planId, entryId);
        entry.moveTo(position);
        entryRepository.updatePosition(entry);
        return entry;
    }

    @Transactional
    public void removeEntry(final String projectId, final String planId,
            final String entryId) {
        final TestPlanEntry entry = getEntry(projectId, planId, entryId);
        entryRepository.delete(entry.id());
        LOG.info("Removed entry {} from plan {}", entryId, planId);
    }

    /**
     * Removes several entries of a plan. Unknown IDs are ignored.
     *
     * @param projectId the project ID
     * @param planId the plan ID
     * @param entryIds the entry IDs
     * @return how many entries were removed
     */
    @Transactional
    public int removeEntries(final String projectId, final String planId,
            final List<String> entryIds) {
        getById(projectId, planId);
        final int removed = entryRepository.deleteAll(planId,
                new LinkedHashSet<>(entryIds));
        LOG.info("Removed {} entries from plan {}", removed, planId);
        return removed;
    }

    private TestPlanEntry getEntry(final String projectId,
            final String planId, final String entryId) {
        getById(projectId, planId);
        return entryRepository.findById(planId, entryId)
                .orElseThrow(() -> DomainException.notFound("Entry", entryId));
    }

    private void requireMilestone(final String projectId,
            final String milestoneId) {
        if (milestoneId != null
                && milestoneRepository.findById(projectId, milestoneId)
                        .isEmpty()) {
            throw DomainException.notFound("Milestone", milestoneId);
        }
    }

}
