package co.fanki.qualityhub.suite.application;

import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.suite.domain.Section;
import co.fanki.qualityhub.suite.domain.SectionRepository;
import co.fanki.qualityhub.suite.domain.TestSuite;
import co.fanki.qualityhub.suite.domain.TestSuiteRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.same;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link TestSuiteService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class TestSuiteServiceTest {

    private static final String PROJECT = "project-1";

    private TestSuiteRepository suiteRepository;
    private SectionRepository sectionRepository;

    private TestSuiteService service;

    private TestSuite suite;

    @BeforeEach
    void setUp() {
        suiteRepository = createMock(TestSuiteRepository.class);
        sectionRepository = createMock(SectionRepository.class);
        service = new TestSuiteService(suiteRepository, sectionRepository);

        suite = TestSuite.create(PROJECT, "Regression", null);
    }

    @Test
    void whenGettingSuite_givenOtherProject_shouldThrowNotFound() {
        expect(suiteRepository.findById("project-2", suite.id()))
                .andReturn(Optional.empty());
        replay(suiteRepository);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.getById("project-2", suite.id()));

        assertEquals("TEST_SUITE_NOT_FOUND", error.getErrorCode());
    }

    @Test
    void whenCreatingSection_givenMissingParent_shouldThrowNotFound() {
        expectSuite();
        expect(sectionRepository.findById(suite.id(), "ghost"))
                .andReturn(Optional.empty());
        replay(suiteRepository, sectionRepository);

        final DomainException error = assertThrows(DomainException.class,
                () -> service.createSection(PROJECT, suite.id(), "ghost",
                        "Login", null));

        verify(suiteRepository, sectionRepository);
        assertEquals("SECTION_NOT_FOUND", error.getErrorCode());
    }

    @Test
    void whenCreatingSection_givenTopLevel_shouldSave() {
        expectSuite();
        sectionRepository.save(anyObject(Section.class));
        expectLastCall();
        replay(suiteRepository, sectionRepository);

        final Section section = service.createSection(PROJECT, suite.id(),
                null, "Login", 2);

        verify(suiteRepository, sectionRepository);
        assertEquals(2, section.position());
        assertEquals(suite.id(), section.suiteId());
    }

    @Test
    void whenUpdatingSection_givenItselfAsParent_shouldThrowException() {
        final Section section = Section.create(suite.id(), null, "Login", 0);
        expectSuite();
        expect(sectionRepository.findById(suite.id(), section.id()))
                .andReturn(Optional.of(section));
        replay(suiteRepository, sectionRepository);

        assertThrows(IllegalArgumentException.class,
                () -> service.updateSection(PROJECT, suite.id(), section.id(),
                        section.id(), null, null));
    }

    @Test
    void whenUpdatingSection_givenOwnDescendantAsParent_shouldRejectCycle() {
        final Section root = Section.create(suite.id(), null, "Auth", 0);
        final Section child = Section.create(suite.id(), root.id(), "Login",
                0);
        final Section grandChild = Section.create(suite.id(), child.id(),
                "Errors", 0);
        expectSuite();
        expect(sectionRepository.findById(suite.id(), root.id()))
                .andReturn(Optional.of(root));
        expect(sectionRepository.findById(suite.id(), grandChild.id()))
                .andReturn(Optional.of(grandChild));
        expect(sectionRepository.findBySuite(suite.id()))
                .andReturn(List.of(root, child, grandChild));
        replay(suiteRepository, sectionRepository);

        final IllegalArgumentException error = assertThrows(
                IllegalArgumentException.class,
                () -> service.updateSection(PROJECT, suite.id(), root.id(),
                        grandChild.id(), null, null));

        verify(suiteRepository, sectionRepository);
        assertEquals("A section cannot be moved below its own descendant",
                error.getMessage());
    }

    @Test
    void whenUpdatingSection_givenSiblingAsParent_shouldPersist() {
        final Section first = Section.create(suite.id(), null, "Auth", 0);
        final Section second = Section.create(suite.id(), null, "Billing", 1);
        expectSuite();
        expect(sectionRepository.findById(suite.id(), second.id()))
                .andReturn(Optional.of(second));
        expect(sectionRepository.findById(suite.id(), first.id()))
                .andReturn(Optional.of(first));
        expect(sectionRepository.findBySuite(suite.id()))
                .andReturn(List.of(first, second));
        sectionRepository.update(same(second));
        expectLastCall();
        replay(suiteRepository, sectionRepository);

        final Section updated = service.updateSection(PROJECT, suite.id(),
                second.id(), first.id(), "Payments", 4);

        verify(suiteRepository, sectionRepository);
        assertEquals(first.id(), updated.parentId());
        assertEquals("Payments", updated.name());
        assertEquals(4, updated.position());
    }

    private void expectSuite() {
        expect(suiteRepository.findById(PROJECT, suite.id()))
                .andReturn(Optional.of(suite)).anyTimes();
    }

}
