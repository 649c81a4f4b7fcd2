package co.fanki.qualityhub.testcase.domain;

import co.fanki.qualityhub.organization.domain.Organization;
import co.fanki.qualityhub.organization.domain.OrganizationPlan;
import co.fanki.qualityhub.organization.domain.OrganizationRepository;
import co.fanki.qualityhub.organization.domain.OrganizationSlug;
import co.fanki.qualityhub.project.domain.Project;
import co.fanki.qualityhub.project.domain.ProjectRepository;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for TestCaseRepository using TestContainers.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class TestCaseRepositoryIntegrationTest {

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

    private TestCaseRepository repository;

    private Project project;

    @BeforeEach
    void setUp() {
        repository = new TestCaseRepository(jdbi);
        jdbi.useHandle(handle -> handle.execute("DELETE FROM organizations"));

        final Organization organization = Organization.create("Acme",
                OrganizationSlug.of("acme"), OrganizationPlan.FREE, null);
        new OrganizationRepository(jdbi).save(organization);
        project = Project.create(organization.id(), "Checkout", null, null);
        new ProjectRepository(jdbi).save(project);
    }

    @Test
    void whenUpdating_givenCurrentVersion_shouldWriteNextVersion() {
        final TestCase testCase = createTestCase("Login works");
        repository.save(testCase);

        final TestCase loaded = repository.findById(project.id(),
                testCase.id()).orElseThrow();
        final int loadedVersion = loaded.version();
        loaded.update(details("Login works with SSO"));

        assertTrue(repository.update(loaded, loadedVersion));

        final TestCase stored = repository.findById(project.id(),
                testCase.id()).orElseThrow();
        assertEquals(2, stored.version());
        assertEquals("Login works with SSO", stored.title());
    }

    @Test
    void whenUpdating_givenStaleVersion_shouldReturnFalseAndKeepWinner() {
        final TestCase testCase = createTestCase("Login works");
        repository.save(testCase);

        final TestCase first = repository.findById(project.id(),
                testCase.id()).orElseThrow();
        final TestCase second = repository.findById(project.id(),
                testCase.id()).orElseThrow();

        first.update(details("Login works with SSO"));
        assertTrue(repository.update(first, 1));

        second.update(details("Login works with passwords"));
        assertFalse(repository.update(second, 1));

        final TestCase stored = repository.findById(project.id(),
                testCase.id()).orElseThrow();
        assertEquals(2, stored.version());
        assertEquals("Login works with SSO", stored.title());
    }

    @Test
    void whenUpdating_givenDeletedCase_shouldReturnFalse() {
        final TestCase testCase = createTestCase("Login works");
        repository.save(testCase);
        assertEquals(1, repository.softDelete(project.id(),
                List.of(testCase.id())));

        testCase.update(details("Login works with SSO"));

        assertFalse(repository.update(testCase, 1));
        assertFalse(repository.findById(project.id(), testCase.id())
                .isPresent());
    }

    private TestCase createTestCase(final String title) {
        return TestCase.create(project.id(), details(title), null);
    }

    private static TestCaseDetails details(final String title) {
        return new TestCaseDetails(null, title, null, null, null, null, null,
                null, null);
    }

}
