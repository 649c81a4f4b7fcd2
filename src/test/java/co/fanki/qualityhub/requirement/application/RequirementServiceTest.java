package co.fanki.qualityhub.requirement.application;

import co.fanki.qualityhub.requirement.domain.CoverageStatistics;
import co.fanki.qualityhub.requirement.domain.Requirement;
import co.fanki.qualityhub.requirement.domain.RequirementCoverage;
import co.fanki.qualityhub.requirement.domain.RequirementCoverageRepository;
import co.fanki.qualityhub.requirement.domain.RequirementRepository;
import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.testcase.domain.TestCase;
import co.fanki.qualityhub.testcase.domain.TestCaseDetails;
import co.fanki.qualityhub.testcase.domain.TestCaseRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link RequirementService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RequirementServiceTest {

    private static final String PROJECT = "project-1";

    private RequirementRepository requirementRepository;
    private RequirementCoverageRepository coverageRepository;
    private TestCaseRepository caseRepository;

    private RequirementService service;

    private Requirement requirement;

    @BeforeEach
    void setUp() {
        requirementRepository = createMock(RequirementRepository.class);
        coverageRepository = createMock(RequirementCoverageRepository.class);
        caseRepository = createMock(TestCaseRepository.class);
        service = new RequirementService(requirementRepository,
                coverageRepository, caseRepository);

        requirement = Requirement.create(PROJECT, "REQ-1", "User can log in",
                null, null, null, null, "user-1");
    }

    @Test
    void whenComputingProjectStatistics_givenNoRequirements_shouldSkipCoverageQuery() {
        expect(requirementRepository.countByProject(PROJECT)).andReturn(0L);
        replay(requirementRepository, coverageRepository);

        final CoverageStatistics statistics = service.projectStatistics(
                PROJECT);

        verify(requirementRepository, coverageRepository);
        assertEquals(CoverageStatistics.empty(), statistics);
    }

    @Test
    void whenComputingProjectStatistics_givenRequirements_shouldRoundCoverage() {
        expect(requirementRepository.countByProject(PROJECT)).andReturn(3L);
        expect(coverageRepository.countCoveredRequirements(PROJECT))
                .andReturn(2L);
        replay(requirementRepository, coverageRepository);

        final CoverageStatistics statistics = service.projectStatistics(
                PROJECT);

        verify(requirementRepository, coverageRepository);
        assertEquals(1, statistics.uncoveredRequirements());
        assertEquals(67, statistics.coveragePercentage());
    }

    @Test
    void whenAddingCoverage_givenSomeAlreadyLinked_shouldLinkOnlyNewCases() {
        final TestCase second = testCase();
        expectRequirement();
        expect(coverageRepository.caseIdsIn(eq(requirement.id()),
                eq(Set.of("case-1", second.id()))))
                .andReturn(Set.of("case-1"));
        expect(caseRepository.findByIds(PROJECT, Set.of(second.id())))
                .andReturn(List.of(second));
        coverageRepository.save(anyObject(RequirementCoverage.class));
        expectLastCall();
        replay(requirementRepository, coverageRepository, caseRepository);

        final List<RequirementCoverage> added = service.addCoverage(PROJECT,
                requirement.id(), List.of("case-1", second.id(), "case-1"),
                "user-2");

        verify(requirementRepository, coverageRepository, caseRepository);
        assertEquals(1, added.size());
        assertEquals(second.id(), added.get(0).caseId());
        assertEquals("user-2", added.get(0).createdBy());
    }

    @Test
    void whenAddingCoverage_givenUnknownCase_shouldThrowNotFound() {
        expectRequirement();
        expect(coverageRepository.caseIdsIn(eq(requirement.id()),
                eq(Set.of("ghost")))).andReturn(Set.of());
        expect(caseRepository.findByIds(PROJECT, Set.of("ghost")))
                .andReturn(List.of());
        replay(requirementRepository, coverageRepository, caseRepository);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.addCoverage(PROJECT, requirement.id(),
                        List.of("ghost"), "user-2"));

        verify(requirementRepository, coverageRepository, caseRepository);
        assertEquals("TEST_CASE_NOT_FOUND", error.getErrorCode());
    }

    @Test
    void whenRemovingCoverage_givenUnlinkedCase_shouldThrowCoverageNotFound() {
        expectRequirement();
        expect(coverageRepository.delete(requirement.id(), "case-9"))
                .andReturn(false);
        replay(requirementRepository, coverageRepository);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.removeCoverage(PROJECT, requirement.id(),
                        "case-9"));

        verify(requirementRepository, coverageRepository);
        assertEquals("COVERAGE_NOT_FOUND", error.getErrorCode());
        assertEquals("Coverage for test case case-9 not found in requirement "
                + requirement.id(), error.getMessage());
    }

    @Test
    void whenGettingRequirement_givenOtherProject_shouldThrowNotFound() {
        expect(requirementRepository.findById("project-2", requirement.id()))
                .andReturn(Optional.empty());
        replay(requirementRepository);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.getById("project-2", requirement.id()));

        assertEquals("REQUIREMENT_NOT_FOUND", error.getErrorCode());
    }

    @Test
    void whenComputingStatistics_givenLinkedCases_shouldCountThem() {
        expectRequirement();
        expect(coverageRepository.countByRequirement(requirement.id()))
                .andReturn(4L);
        replay(requirementRepository, coverageRepository);

        final RequirementService.RequirementStatistics statistics =
                service.statistics(PROJECT, requirement.id());

        verify(requirementRepository, coverageRepository);
        assertEquals(4, statistics.totalTestCases());
    }

    private void expectRequirement() {
        expect(requirementRepository.findById(PROJECT, requirement.id()))
                .andReturn(Optional.of(requirement));
    }

    private static TestCase testCase() {
        return TestCase.create(PROJECT, new TestCaseDetails(null,
                "Login works", null, null, null, null, null, null, null),
                null);
    }

}
