package co.fanki.qualityhub.project.domain;

import co.fanki.qualityhub.organization.domain.Organization;
import co.fanki.qualityhub.organization.domain.OrganizationPlan;
import co.fanki.qualityhub.organization.domain.OrganizationRepository;
import co.fanki.qualityhub.organization.domain.OrganizationSlug;

import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for ProjectRepository using TestContainers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class ProjectRepositoryIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:14")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(final DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private Jdbi jdbi;

    private ProjectRepository repository;

    private Organization organization;

    @BeforeEach
    void setUp() {
        repository = new ProjectRepository(jdbi);
        jdbi.useHandle(handle -> handle.execute("DELETE FROM organizations"));

        organization = Organization.create("Acme",
                OrganizationSlug.of("acme"), OrganizationPlan.FREE, null);
        new OrganizationRepository(jdbi).save(organization);
    }

    @Test
    void whenSavingProject_givenValidProject_shouldPersist() {
        final Project project = createTestProject("Checkout");

        repository.save(project);

        final Optional<Project> found = repository.findById(project.id());
        assertTrue(found.isPresent());
        assertEquals("Checkout", found.get().name());
        assertEquals(organization.id(), found.get().organizationId());
        assertEquals("blue", found.get().settings().get("color"));
    }

    @Test
    void whenUpdatingProject_givenNewName_shouldPersistChanges() {
        final Project project = createTestProject("Checkout");
        repository.save(project);

        project.update("Checkout v2", "Second iteration", null);
        repository.update(project);

        final Project found = repository.findById(project.id()).orElseThrow();
        assertEquals("Checkout v2", found.name());
        assertEquals("Second iteration", found.description());
    }

    @Test
    void whenFindingByOrganization_givenTwoProjects_shouldReturnBoth() {
        repository.save(createTestProject("Checkout"));
        repository.save(createTestProject("Payments"));

        final List<Project> projects = repository.findByOrganization(
                organization.id());

        assertEquals(2, projects.size());
    }

    @Test
    void whenSoftDeleting_givenLiveProject_shouldHideIt() {
        final Project project = createTestProject("Checkout");
        repository.save(project);

        assertTrue(repository.softDelete(project.id()));

        assertFalse(repository.findById(project.id()).isPresent());
        assertTrue(repository.findByOrganization(organization.id()).isEmpty());
    }

    @Test
    void whenSoftDeleting_givenAlreadyDeletedProject_shouldReturnFalse() {
        final Project project = createTestProject("Checkout");
        repository.save(project);
        repository.softDelete(project.id());

        assertFalse(repository.softDelete(project.id()));
    }

    private Project createTestProject(final String name) {
        return Project.create(organization.id(), name, "Main product",
                Map.of("color", "blue"));
    }

}
