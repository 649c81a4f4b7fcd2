package co.fanki.qualityhub.project.domain;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Project aggregate.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectTest {

    @Test
    void whenCreatingProject_givenValidData_shouldCreateLiveProject() {
        final Project project = Project.create("org-1", "Checkout",
                "Checkout flows", null);

        assertNotNull(project.id());
        assertEquals("org-1", project.organizationId());
        assertEquals("Checkout", project.name());
        assertEquals("Checkout flows", project.description());
        assertEquals(project.createdAt(), project.updatedAt());
        assertNull(project.deletedAt());
    }

    @Test
    void whenCreatingProject_givenBlankName_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Project.create("org-1", "  ", null, null));
    }

    @Test
    void whenCreatingProject_givenTooLongName_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Project.create("org-1", "x".repeat(256), null, null));
    }

    @Test
    void whenCreatingProject_givenMissingOrganization_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Project.create(null, "Checkout", null, null));
    }

    @Test
    void whenUpdating_givenOnlyDescription_shouldKeepName() {
        final Project project = Project.create("org-1", "Checkout", null,
                Map.of("color", "blue"));

        project.update(null, "New description", null);

        assertEquals("Checkout", project.name());
        assertEquals("New description", project.description());
        assertEquals("blue", project.settings().get("color"));
    }

    @Test
    void whenUpdating_givenInvalidName_shouldThrowException() {
        final Project project = Project.create("org-1", "Checkout", null,
                null);

        assertThrows(IllegalArgumentException.class,
                () -> project.update("", null, null));
    }

    @Test
    void whenCheckingOwnership_givenOtherOrganization_shouldReturnFalse() {
        final Project project = Project.create("org-1", "Checkout", null,
                null);

        assertTrue(project.belongsTo("org-1"));
        assertFalse(project.belongsTo("org-2"));
    }

}
