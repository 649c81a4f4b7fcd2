package co.fanki.qualityhub.suite.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * A named container of sections and test cases inside a project.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TestSuite {

    private final String id;
    private final String projectId;
    private String name;
    private String description;
    private final Instant createdAt;

    private TestSuite(final String theId, final String theProjectId,
            final String theName, final String theDescription,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Suite ID is required");
        this.projectId = Preconditions.requireNonBlank(theProjectId,
                "Project ID is required");
        this.name = Preconditions.requireLength(theName, 1, 255, "Suite name");
        this.description = theDescription;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    /**
     * Creates a new suite.
     *
     * @param projectId the owning project
     * @param name the suite name
     * @param description the description, may be null
     * @return a new TestSuite
     */
    public static TestSuite create(final String projectId, final String name,
            final String description) {
        return new TestSuite(UUID.randomUUID().toString(), projectId, name,
                description, Instant.now());
    }

    /**
     * Reconstitutes a suite from persistence.
     *
     * @param id the suite ID
     * @param projectId the owning project
     * @param name the name
     * @param description the description
     * @param createdAt when created
     * @return the reconstituted TestSuite
     */
    public static TestSuite reconstitute(final String id,
            final String projectId, final String name,
            final String description, final Instant createdAt) {
        return new TestSuite(id, projectId, name, description, createdAt);
    }

    /**
     * Applies a partial update. Null arguments leave the field untouched.
     *
     * @param newName the new name
     * @param newDescription the new description
     */
    public void update(final String newName, final String newDescription) {
        if (newName != null) {
            this.name = Preconditions.requireLength(newName, 1, 255,
                    "Suite name");
        }
        if (newDescription != null) {
            this.description = newDescription;
        }
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
