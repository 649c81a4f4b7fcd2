package co.fanki.qualityhub.milestone.application;

import co.fanki.qualityhub.milestone.application.MilestoneService.MilestoneProgress;
import co.fanki.qualityhub.milestone.domain.Milestone;
import co.fanki.qualityhub.milestone.domain.MilestoneRepository;
import co.fanki.qualityhub.plan.domain.TestPlanRepository;
import co.fanki.qualityhub.shared.DomainException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link MilestoneService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MilestoneServiceTest {

    private static final String PROJECT_ID = "project-1";

    private MilestoneRepository milestoneRepository;
    private TestPlanRepository planRepository;
    private MilestoneService service;

    @BeforeEach
    void setUp() {
        milestoneRepository = createMock(MilestoneRepository.class);
        planRepository = createMock(TestPlanRepository.class);
        service = new MilestoneService(milestoneRepository, planRepository);
    }

    @Test
    void whenCreating_givenValidInput_shouldSaveOpenMilestone() {
        milestoneRepository.save(anyObject(Milestone.class));
        expectLastCall();
        replay(milestoneRepository, planRepository);

        final Milestone milestone = service.create(PROJECT_ID, "Release 2.0",
                null, Instant.parse("2026-03-01T00:00:00Z"));

        verify(milestoneRepository, planRepository);
        assertEquals(PROJECT_ID, milestone.projectId());
        assertFalse(milestone.isCompleted());
    }

    @Test
    void whenUpdating_givenCompletion_shouldPersistCompletedMilestone() {
        final Milestone milestone = milestone(false);
        expect(milestoneRepository.findById(PROJECT_ID, "ms-1"))
                .andReturn(Optional.of(milestone));
        milestoneRepository.update(milestone);
        expectLastCall();
        replay(milestoneRepository, planRepository);

        final Milestone updated = service.update(PROJECT_ID, "ms-1", null,
                null, null, true);

        verify(milestoneRepository, planRepository);
        assertTrue(updated.isCompleted());
        assertEquals("Release 2.0", updated.name());
    }

    @Test
    void whenReadingProgress_givenOpenMilestoneWithPlans_shouldReportZero() {
        expect(milestoneRepository.findById(PROJECT_ID, "ms-1"))
                .andReturn(Optional.of(milestone(false)));
        expect(planRepository.countByMilestone("ms-1")).andReturn(4L);
        replay(milestoneRepository, planRepository);

        final MilestoneProgress progress = service.progress(PROJECT_ID,
                "ms-1");

        verify(milestoneRepository, planRepository);
        assertEquals(4L, progress.totalTestPlans());
        assertFalse(progress.isCompleted());
        assertEquals(0, progress.progressPercentage());
    }

    @Test
    void whenReadingProgress_givenCompletedMilestone_shouldReportHundred() {
        expect(milestoneRepository.findById(PROJECT_ID, "ms-1"))
                .andReturn(Optional.of(milestone(true)));
        expect(planRepository.countByMilestone("ms-1")).andReturn(0L);
        replay(milestoneRepository, planRepository);

        final MilestoneProgress progress = service.progress(PROJECT_ID,
                "ms-1");

        verify(milestoneRepository, planRepository);
        assertEquals(100, progress.progressPercentage());
    }

    @Test
    void whenListingPlans_givenUnknownMilestone_shouldThrowNotFound() {
        expect(milestoneRepository.findById(PROJECT_ID, "missing"))
                .andReturn(Optional.empty());
        replay(milestoneRepository, planRepository);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.plans(PROJECT_ID, "missing"));

        verify(milestoneRepository, planRepository);
        assertEquals("MILESTONE_NOT_FOUND", error.getErrorCode());
    }

    @Test
    void whenListingPlans_givenMilestone_shouldReturnItsPlans() {
        expect(milestoneRepository.findById(PROJECT_ID, "ms-1"))
                .andReturn(Optional.of(milestone(false)));
        expect(planRepository.findByMilestone("ms-1")).andReturn(List.of());
        replay(milestoneRepository, planRepository);

        assertTrue(service.plans(PROJECT_ID, "ms-1").isEmpty());

        verify(milestoneRepository, planRepository);
    }

    @Test
    void whenDeleting_givenMilestone_shouldSoftDelete() {
        expect(milestoneRepository.findById(PROJECT_ID, "ms-1"))
                .andReturn(Optional.of(milestone(false)));
        expect(milestoneRepository.softDelete("ms-1")).andReturn(true);
        replay(milestoneRepository, planRepository);

        service.delete(PROJECT_ID, "ms-1");

        verify(milestoneRepository, planRepository);
    }

    private static Milestone milestone(final boolean completed) {
        return Milestone.reconstitute("ms-1", PROJECT_ID, "Release 2.0",
                null, null, completed, Instant.parse("2026-01-01T00:00:00Z"),
                null);
    }

}
