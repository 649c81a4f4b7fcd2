package co.fanki.qualityhub.milestone.application;

import co.fanki.qualityhub.milestone.domain.Milestone;
import co.fanki.qualityhub.milestone.domain.MilestoneRepository;
import co.fanki.qualityhub.plan.domain.TestPlan;
import co.fanki.qualityhub.plan.domain.TestPlanRepository;
import co.fanki.qualityhub.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Application service for milestones.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class MilestoneService {

    private static final Logger LOG = LoggerFactory.getLogger(
            MilestoneService.class);

    private final MilestoneRepository milestoneRepository;
    private final TestPlanRepository planRepository;

    /**
     * Creates a new MilestoneService.
     *
     * @param theMilestoneRepository the milestone repository
     * @param thePlanRepository the test plan repository
     */
    public MilestoneService(final MilestoneRepository theMilestoneRepository,
            final TestPlanRepository thePlanRepository) {
        this.milestoneRepository = theMilestoneRepository;
        this.planRepository = thePlanRepository;
    }

    @Transactional
    public Milestone create(final String projectId, final String name,
            final String description, final Instant dueDate) {
        final Milestone milestone = Milestone.create(projectId, name,
                description, dueDate);
        milestoneRepository.save(milestone);
        LOG.info("Milestone created with ID: {}", milestone.id());
        return milestone;
    }

    public List<Milestone> findByProject(final String projectId) {
        return milestoneRepository.findByProject(projectId);
    }

    /**
     * Finds a live milestone of a project, throwing if not found.
     *
     * @param projectId the project ID
     * @param milestoneId the milestone ID
     * @return the milestone
     */
    public Milestone getById(final String projectId,
            final String milestoneId) {
        return milestoneRepository.findById(projectId, milestoneId)
                .orElseThrow(() -> DomainException.notFound(
                        "Milestone", milestoneId));
    }

    @Transactional
    public Milestone update(final String projectId, final String milestoneId,
            final String name, final String description,
            final Instant dueDate, final Boolean completed) {
        final Milestone milestone = getById(projectId, milestoneId);
        milestone.update(name, description, dueDate, completed);
        milestoneRepository.update(milestone);
        LOG.info("Updated milestone {}", milestoneId);
        return milestone;
    }

    @Transactional
    public void delete(final String projectId, final String milestoneId) {
        getById(projectId, milestoneId);
        milestoneRepository.softDelete(milestoneId);
        LOG.info("Deleted milestone {}", milestoneId);
    }

    /**
     * Reports how far a milestone is.
     *
     * @param projectId the project ID
     * @param milestoneId the milestone ID
     * @return the progress
     */
    public MilestoneProgress progress(final String projectId,
            final String milestoneId) {
        final Milestone milestone = getById(projectId, milestoneId);
        return new MilestoneProgress(milestoneId,
                planRepository.countByMilestone(milestoneId),
                milestone.isCompleted(), milestone.progressPercentage());
    }

    public List<TestPlan> plans(final String projectId,
            final String milestoneId) {
        getById(projectId, milestoneId);
        return planRepository.findByMilestone(milestoneId);
    }

    /**
     * Progress of a milestone.
     *
     * @param milestoneId the milestone ID
     * @param totalTestPlans live plans aimed at the milestone
     * @param isCompleted whether the milestone is completed
     * @param progressPercentage 100 when completed, 0 otherwise
     */
    public record MilestoneProgress(
            String milestoneId,
            long totalTestPlans,
            boolean isCompleted,
            int progressPercentage
    ) {}

}
