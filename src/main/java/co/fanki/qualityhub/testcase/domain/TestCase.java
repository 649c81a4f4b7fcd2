package co.fanki.qualityhub.testcase.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate root for a test case.
 *
 * <p>Every change bumps {@link #version()}; the service stores a
 * {@link TestCaseVersion} snapshot for each version, so the history of a
 * case can be replayed from version 1 on.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TestCase {

    private final String id;
    private final String projectId;
    private String sectionId;
    private String title;
    private TestCaseTemplate templateType;
    private String preconditions;
    private List<TestStep> steps;
    private String expectedResult;
    private TestCasePriority priority;
    private Integer estimate;
    private Map<String, Object> customFields;
    private int version;
    private final String createdBy;
    private final Instant createdAt;
    private Instant updatedAt;
    private final Instant deletedAt;

    private TestCase(final String theId, final String theProjectId,
            final int theVersion, final String theCreatedBy,
            final Instant theCreatedAt, final Instant theUpdatedAt,
            final Instant theDeletedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Test case ID is required");
        this.projectId = Preconditions.requireNonBlank(theProjectId,
                "Project ID is required");
        Preconditions.require(theVersion >= 1, "Version starts at 1");
        this.version = theVersion;
        this.createdBy = theCreatedBy;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = theUpdatedAt != null ? theUpdatedAt : this.createdAt;
        this.deletedAt = theDeletedAt;
        this.templateType = TestCaseTemplate.STEPS;
        this.priority = TestCasePriority.MEDIUM;
    }

    /**
     * Creates a new test case at version 1.
     *
     * @param projectId the owning project
     * @param details the content, the title is required
     * @param createdBy the creating user, may be null
     * @return a new TestCase
     */
    public static TestCase create(final String projectId,
            final TestCaseDetails details, final String createdBy) {
        Preconditions.requireNonNull(details, "Test case details are required");
        final TestCase testCase = new TestCase(UUID.randomUUID().toString(),
                projectId, 1, createdBy, Instant.now(), null, null);
        testCase.title = validTitle(details.title());
        testCase.apply(details);
        return testCase;
    }

    /**
     * Reconstitutes a test case from persistence.
     *
     * @param id the ID
     * @param projectId the project
     * @param details the stored content
     * @param version the current version
     * @param createdBy the creating user
     * @param createdAt when created
     * @param updatedAt when last updated
     * @param deletedAt when soft deleted, null while live
     * @return the reconstituted TestCase
     */
    public static TestCase reconstitute(final String id,
            final String projectId, final TestCaseDetails details,
            final int version, final String createdBy,
            final Instant createdAt, final Instant updatedAt,
            final Instant deletedAt) {
        final TestCase testCase = new TestCase(id, projectId, version,
                createdBy, createdAt, updatedAt, deletedAt);
        testCase.title = details.title();
        testCase.sectionId = details.sectionId();
        testCase.apply(details);
        return testCase;
    }

    /**
     * Applies a change and moves the case to its next version.
     *
     * @param details the changes, null fields are left untouched
     */
    public void update(final TestCaseDetails details) {
        Preconditions.requireNonNull(details, "Test case details are required");
        if (details.title() != null) {
            this.title = validTitle(details.title());
        }
        apply(details);
        this.version = version + 1;
        this.updatedAt = Instant.now();
    }

    /**
     * Files the case under another section and moves it to its next
     * version.
     *
     * @param newSectionId the target section, null for no section
     */
    public void moveTo(final String newSectionId) {
        this.sectionId = newSectionId;
        this.version = version + 1;
        this.updatedAt = Instant.now();
    }

    /**
     * Captures the versioned content of the case.
     *
     * @return the snapshot, keyed by field name
     */
    public Map<String, Object> snapshot() {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", title);
        data.put("templateType", templateType.value());
        data.put("preconditions", preconditions);
        data.put("steps", steps);
        data.put("expectedResult", expectedResult);
        data.put("priority", priority.value());
        data.put("estimate", estimate);
        data.put("customFields", customFields);
        data.put("sectionId", sectionId);
        return data;
    }

    public TestCaseDetails details() {
        return new TestCaseDetails(sectionId, title, templateType,
                preconditions, steps, expectedResult, priority, estimate,
                customFields);
    }

    private void apply(final TestCaseDetails details) {
        if (details.sectionId() != null) {
            this.sectionId = details.sectionId();
        }
        if (details.templateType() != null) {
            this.templateType = details.templateType();
        }
        if (details.preconditions() != null) {
            this.preconditions = details.preconditions();
        }
        if (details.steps() != null) {
            this.steps = List.copyOf(details.steps());
        }
        if (details.expectedResult() != null) {
            this.expectedResult = details.expectedResult();
        }
        if (details.priority() != null) {
            this.priority = details.priority();
        }
        if (details.estimate() != null) {
            Preconditions.requireNonNegative(details.estimate(),
                    "Estimate must not be negative");
            this.estimate = details.estimate();
        }
        if (details.customFields() != null) {
            this.customFields = details.customFields();
        }
    }

    private static String validTitle(final String value) {
        return Preconditions.requireLength(value, 3, 500, "Title");
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String sectionId() {
        return sectionId;
    }

    public String title() {
        return title;
    }

    public TestCaseTemplate templateType() {
        return templateType;
    }

    public String preconditions() {
        return preconditions;
    }

    public List<TestStep> steps() {
        return steps != null ? steps : Collections.emptyList();
    }

    public String expectedResult() {
        return expectedResult;
    }

    public TestCasePriority priority() {
        return priority;
    }

    public Integer estimate() {
        return estimate;
    }

    public Map<String, Object> customFields() {
        return customFields;
    }

    public int version() {
        return version;
    }

    public String createdBy() {
        return createdBy;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant deletedAt() {
        return deletedAt;
    }

}
