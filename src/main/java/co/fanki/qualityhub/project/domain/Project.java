package co.fanki.qualityhub.project.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate root representing a testing project of an organization.
 *
 * <p>Suites, test cases, runs, requirements, milestones and plans all hang
 * off a project. Deleting a project only stamps {@code deletedAt}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Project {

    private final String id;
    private final String organizationId;
    private String name;
    private String description;
    private Map<String, Object> settings;
    private final Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    private Project(
            final String theId,
            final String theOrganizationId,
            final String theName,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Project ID is required");
        this.organizationId = Preconditions.requireNonBlank(theOrganizationId,
                "Organization ID is required");
        this.name = Preconditions.requireLength(theName, 1, 255,
                "Project name");
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * Creates a new project.
     *
     * @param organizationId the owning organization
     * @param name the project name
     * @param description the description, may be null
     * @param settings free-form settings, may be null
     * @return a new Project instance
     */
    public static Project create(final String organizationId,
            final String name, final String description,
            final Map<String, Object> settings) {
        final Project project = new Project(UUID.randomUUID().toString(),
                organizationId, name, Instant.now());
        project.description = description;
        project.settings = settings;
        return project;
    }

    /**
     * Reconstitutes a project from persistence.
     *
     * @param id the project ID
     * @param organizationId the owning organization
     * @param name the project name
     * @param description the description
     * @param settings the settings
     * @param createdAt when created
     * @param updatedAt when last updated
     * @param deletedAt when soft deleted, null while live
     * @return the reconstituted Project
     */
    public static Project reconstitute(
            final String id,
            final String organizationId,
            final String name,
            final String description,
            final Map<String, Object> settings,
            final Instant createdAt,
            final Instant updatedAt,
            final Instant deletedAt) {

        final Project project = new Project(id, organizationId, name,
                createdAt);
        project.description = description;
        project.settings = settings;
        project.updatedAt = updatedAt;
        project.deletedAt = deletedAt;
        return project;
    }

    /**
     * Applies a partial update. Null arguments leave the field untouched.
     *
     * @param newName the new name
     * @param newDescription the new description
     * @param newSettings the new settings
     */
    public void update(final String newName, final String newDescription,
            final Map<String, Object> newSettings) {
        if (newName != null) {
            this.name = Preconditions.requireLength(newName, 1, 255,
                    "Project name");
        }
        if (newDescription != null) {
            this.description = newDescription;
        }
        if (newSettings != null) {
            this.settings = newSettings;
        }
        this.updatedAt = Instant.now();
    }

    /**
     * Whether the project belongs to the given organization.
     *
     * @param theOrganizationId the organization ID
     * @return true if it does
     */
    public boolean belongsTo(final String theOrganizationId) {
        return organizationId.equals(theOrganizationId);
    }

    public String id() {
        return id;
    }

    public String organizationId() {
        return organizationId;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Map<String, Object> settings() {
        return settings;
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
