package co.fanki.qualityhub.suite.application;

import co.fanki.qualityhub.shared.DomainException;
import co.fanki.qualityhub.suite.domain.Section;
import co.fanki.qualityhub.suite.domain.SectionRepository;
import co.fanki.qualityhub.suite.domain.TestSuite;
import co.fanki.qualityhub.suite.domain.TestSuiteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Application service for test suites and their sections.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class TestSuiteService {

    private static final Logger LOG = LoggerFactory.getLogger(
            TestSuiteService.class);

    private final TestSuiteRepository suiteRepository;
    private final SectionRepository sectionRepository;

    /**
     * Creates a new TestSuiteService.
     *
     * @param theSuiteRepository the suite repository
     * @param theSectionRepository the section repository
     */
    public TestSuiteService(final TestSuiteRepository theSuiteRepository,
            final SectionRepository theSectionRepository) {
        this.suiteRepository = theSuiteRepository;
        this.sectionRepository = theSectionRepository;
    }

    @Transactional
    public TestSuite create(final String projectId, final String name,
            final String description) {
        final TestSuite suite = TestSuite.create(projectId, name, description);
        suiteRepository.save(suite);
        LOG.info("Test suite created with ID: {}", suite.id());
        return suite;
    }

    public List<TestSuite> findByProject(final String projectId) {
        return suiteRepository.findByProject(projectId);
    }

    /**
     * Finds a suite of a project, throwing if not found.
     *
     * @param projectId the project ID
     * @param suiteId the suite ID
     * @return the suite
     * @throws DomainException if the suite is not in the project
     */
    public TestSuite getById(final String projectId, final String suiteId) {
        return suiteRepository.findById(projectId, suiteId)
                .orElseThrow(() -> DomainException.notFound(
                        "Test suite", suiteId));
    }

    @Transactional
    public TestSuite update(final String projectId, final String suiteId,
            final String name, final String description) {
        final TestSuite suite = getById(projectId, suiteId);
        suite.update(name, description);
        suiteRepository.update(suite);
        LOG.info("Updated test suite {}", suiteId);
        return suite;
    }

    @Transactional
    public void delete(final String projectId, final String suiteId) {
        getById(projectId, suiteId);
        suiteRepository.delete(suiteId);
        LOG.info("Deleted test suite {}", suiteId);
    }

    /**
     * Creates a section in a suite.
     *
     * @param projectId the project ID
     * @param suiteId the suite ID
     * @param parentId the parent section, null for a top level section
     * @param name the section name
     * @param position the position, may be null
     * @return the created section
     * @throws DomainException if the suite or the parent does not exist
     */
    @Transactional
    public Section createSection(final String projectId, final String suiteId,
            final String parentId, final String name, final Integer position) {
        getById(projectId, suiteId);
        if (parentId != null) {
            requireParent(suiteId, parentId);
        }
        final Section section = Section.create(suiteId, parentId, name,
                position);
        sectionRepository.save(section);
        LOG.info("Section created with ID: {} in suite {}", section.id(),
                suiteId);
        return section;
    }

    public List<Section> sections(final String projectId,
            final String suiteId) {
        getById(projectId, suiteId);
        return sectionRepository.findBySuite(suiteId);
    }

    /**
     * Finds a section of a suite, throwing if not found.
     *
     * @param projectId the project ID
     * @param suiteId the suite ID
     * @param sectionId the section ID
     * @return the section
     */
    public Section getSection(final String projectId, final String suiteId,
            final String sectionId) {
        getById(projectId, suiteId);
        return sectionRepository.findById(suiteId, sectionId)
                .orElseThrow(() -> DomainException.notFound(
                        "Section", sectionId));
    }

    /**
     * Updates a section. Null arguments are left untouched.
     *
     * <p>Moving a section below one of its own descendants is rejected, so
     * the section tree never holds a cycle.</p>
     *
     * @param projectId the project ID
     * @param suiteId the suite ID
     * @param sectionId the section ID
     * @param parentId the new parent
     * @param name the new name
     * @param position the new position
     * @return the updated section
     */
    @Transactional
    public Section updateSection(final String projectId, final String suiteId,
            final String sectionId, final String parentId, final String name,
            final Integer position) {
        final Section section = getSection(projectId, suiteId, sectionId);

        if (parentId != null) {
            section.changeParent(parentId);
            requireParent(suiteId, parentId);
            requireNoCycle(suiteId, sectionId, parentId);
        }
        if (name != null) {
            section.rename(name);
        }
        if (position != null) {
            section.moveTo(position);
        }
        sectionRepository.update(section);
        LOG.info("Updated section {}", sectionId);
        return section;
    }

    @Transactional
    public void deleteSection(final String projectId, final String suiteId,
            final String sectionId) {
        final Section section = getSection(projectId, suiteId, sectionId);
        sectionRepository.delete(section.id());
        LOG.info("Deleted section {}", sectionId);
    }

    private void requireParent(final String suiteId, final String parentId) {
        if (sectionRepository.findById(suiteId, parentId).isEmpty()) {
            throw new DomainException("Parent section with ID " + parentId
                    + " not found in suite " + suiteId, "SECTION_NOT_FOUND");
        }
    }

    private void requireNoCycle(final String suiteId, final String sectionId,
            final String parentId) {
        final Map<String, String> parents = new HashMap<>();
        for (Section each : sectionRepository.findBySuite(suiteId)) {
            parents.put(each.id(), each.parentId());
        }
        String current = parentId;
        while (current != null) {
            if (current.equals(sectionId)) {
                throw new IllegalArgumentException(
                        "A section cannot be moved below its own descendant");
            }
            current = parents.get(current);
        }
    }

}
