package co.fanki.qualityhub.suite.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link Section}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SectionTest {

    @Test
    void whenCreating_givenNoPosition_shouldDefaultToZero() {
        final Section section = Section.create("suite-1", null, "Login",
                null);

        assertEquals(0, section.position());
        assertNull(section.parentId());
    }

    @Test
    void whenCreating_givenNegativePosition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Section.create("suite-1", null, "Login", -1));
    }

    @Test
    void whenChangingParent_givenItself_shouldThrowException() {
        final Section section = Section.create("suite-1", null, "Login", 0);

        assertThrows(IllegalArgumentException.class,
                () -> section.changeParent(section.id()));
    }

    @Test
    void whenChangingParent_givenNull_shouldMoveToTopLevel() {
        final Section section = Section.create("suite-1", "parent-1",
                "Login", 0);

        section.changeParent(null);

        assertNull(section.parentId());
    }

    @Test
    void whenReconstituting_givenSelfParent_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Section.reconstitute("s-1", "suite-1", "s-1", "Login",
                        0, null));
    }

    @Test
    void whenRenaming_givenBlankName_shouldThrowException() {
        final Section section = Section.create("suite-1", null, "Login", 0);

        assertThrows(IllegalArgumentException.class,
                () -> section.rename(""));
    }

}
