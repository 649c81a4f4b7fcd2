package co.fanki.qualityhub.plan.application;

import co.fanki.qualityhub.milestone.domain.MilestoneRepository;
import co.fanki.qualityhub.plan.domain.TestPlan;
import co.fanki.qualityhub.plan.domain.TestPlanEntry;
import co.fanki.qualityhub.plan.domain.TestPlanEntryRepository;
import co.fanki.qualityhub.plan.domain.TestPlanRepository;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.testcase.domain.TestCase;
import co.fanki.qualityhub.testcase.domain.TestCaseDetails;
import co.fanki.qualityhub.testcase.domain.TestCaseRepository;

import org.easymock.Capture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TestPlanService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TestPlanServiceTest {

    private static final String PROJECT = "project-1";

    private TestPlanRepository planRepository;
    private TestPlanEntryRepository entryRepository;
    private MilestoneRepository milestoneRepository;
    private TestCaseRepository caseRepository;
    private TestPlanService service;

    private TestPlan plan;

    @BeforeEach
    void setUp() {
        planRepository = createMock(TestPlanRepository.class);
        entryRepository = createMock(TestPlanEntryRepository.class);
        milestoneRepository = createMock(MilestoneRepository.class);
        caseRepository = createMock(TestCaseRepository.class);
        service = new TestPlanService(planRepository, entryRepository,
                milestoneRepository, caseRepository);
        plan = TestPlan.create(PROJECT, null, "Regression", null);
    }

    @Test
    void whenCreating_givenUnknownMilestone_shouldThrowNotFound() {
        expect(milestoneRepository.findById(PROJECT, "ms-9"))
                .andReturn(Optional.empty());
        replayAll();

        final DomainException error = assertThrows(DomainException.class,
                () -> service.create(PROJECT, "ms-9", "Regression", null));

        verifyAll();
        assertEquals("MILESTONE_NOT_FOUND", error.getErrorCode());
    }

    @Test
    void whenAddingEntry_givenNoPosition_shouldAppendAfterLast() {
        final TestCase testCase = testCase();
        expectPlan();
        expect(caseRepository.findById(PROJECT, testCase.id()))
                .andReturn(Optional.of(testCase));
        expect(entryRepository.exists(plan.id(), testCase.id()))
                .andReturn(false);
        expect(entryRepository.maxPosition(plan.id())).andReturn(4);
        final Capture<TestPlanEntry> saved = newCapture();
        entryRepository.save(capture(saved));
        expectLastCall();
        replayAll();

        final TestPlanEntry entry = service.addEntry(PROJECT, plan.id(),
                testCase.id(), null);

        verifyAll();
        assertEquals(5, entry.position());
        assertEquals(entry, saved.getValue());
    }

    @Test
    void whenAddingEntry_givenCaseAlreadyPlanned_shouldThrowConflict() {
        final TestCase testCase = testCase();
        expectPlan();
        expect(caseRepository.findById(PROJECT, testCase.id()))
                .andReturn(Optional.of(testCase));
        expect(entryRepository.exists(plan.id(), testCase.id()))
                .andReturn(true);
        replayAll();

        final DomainException error = assertThrows(DomainException.class,
                () -> service.addEntry(PROJECT, plan.id(), testCase.id(), 0));

        verifyAll();
        assertTrue(error.isConflict());
    }

    @Test
    void whenAddingEntries_givenSomeAlreadyPlanned_shouldAppendOnlyNewOnes() {
        final TestCase first = testCase();
        final TestCase second = testCase();
        expectPlan();
        expect(caseRepository.findByIds(PROJECT,
                Set.of(first.id(), second.id())))
                .andReturn(List.of(first, second));
        expect(entryRepository.caseIdsIn(plan.id(),
                Set.of(first.id(), second.id())))
                .andReturn(Set.of(first.id()));
        expect(entryRepository.maxPosition(plan.id())).andReturn(0);
        entryRepository.save(anyObject(TestPlanEntry.class));
        expectLastCall();
        replayAll();

        final List<TestPlanEntry> added = service.addEntries(PROJECT,
                plan.id(), List.of(first.id(), second.id()));

        verifyAll();
        assertEquals(1, added.size());
        assertEquals(second.id(), added.get(0).caseId());
        assertEquals(1, added.get(0).position());
    }

    @Test
    void whenAddingEntries_givenUnknownCase_shouldNameIt() {
        final TestCase known = testCase();
        expectPlan();
        expect(caseRepository.findByIds(PROJECT, Set.of(known.id(), "ghost")))
                .andReturn(List.of(known));
        replayAll();

        final DomainException error = assertThrows(DomainException.class,
                () -> service.addEntries(PROJECT, plan.id(),
                        List.of(known.id(), "ghost")));

        verifyAll();
        assertEquals("TEST_CASE_NOT_FOUND", error.getErrorCode());
        assertEquals("Test case with ID ghost not found", error.getMessage());
    }

    @Test
    void whenUpdatingEntry_givenNegativePosition_shouldReject() {
        expectPlan();
        expect(entryRepository.findById(plan.id(), "entry-1"))
                .andReturn(Optional.of(TestPlanEntry.create(plan.id(),
                        "case-1", 2)));
        replayAll();

        assertThrows(IllegalArgumentException.class,
                () -> service.updateEntry(PROJECT, plan.id(), "entry-1", -1));

        verifyAll();
    }

    @Test
    void whenRemovingEntries_givenIds_shouldReportRemovedCount() {
        expectPlan();
        expect(entryRepository.deleteAll(plan.id(), Set.of("e-1", "e-2")))
                .andReturn(1);
        replayAll();

        assertEquals(1, service.removeEntries(PROJECT, plan.id(),
                List.of("e-1", "e-2", "e-1")));

        verifyAll();
    }

    @Test
    void whenReadingMilestone_givenPlanWithoutMilestone_shouldBeEmpty() {
        expectPlan();
        replayAll();

        assertTrue(service.milestone(PROJECT, plan.id()).isEmpty());

        verifyAll();
    }

    private void expectPlan() {
        expect(planRepository.findById(PROJECT, plan.id()))
                .andReturn(Optional.of(plan)).anyTimes();
    }

    private void replayAll() {
        replay(planRepository, entryRepository, milestoneRepository,
                caseRepository);
    }

    private void verifyAll() {
        verify(planRepository, entryRepository, milestoneRepository,
                caseRepository);
    }

    private static TestCase testCase() {
        return TestCase.create(PROJECT, new TestCaseDetails(null,
                "Login works", null, null, null, null, null, null, null),
                null);
    }

}
