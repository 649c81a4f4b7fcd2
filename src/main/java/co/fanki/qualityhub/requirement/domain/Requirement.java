package co.fanki.qualityhub.requirement.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate root for a requirement that test cases can cover.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Requirement {

    private final String id;
    private final String projectId;
    private String externalId;
    private String title;
    private String description;
    private RequirementSource source;
    private RequirementStatus status;
    private Map<String, Object> customFields;
    private final String createdBy;
    private final Instant createdAt;
    private Instant updatedAt;

    private Requirement(final String theId, final String theProjectId,
            final String theTitle, final RequirementSource theSource,
            final RequirementStatus theStatus, final String theCreatedBy,
            final Instant theCreatedAt, final Instant theUpdatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Requirement ID is required");
        this.projectId = Preconditions.requireNonBlank(theProjectId,
                "Project ID is required");
        this.title = validTitle(theTitle);
        this.source = theSource != null ? theSource : RequirementSource.MANUAL;
        this.status = theStatus != null ? theStatus : RequirementStatus.DRAFT;
        this.createdBy = theCreatedBy;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = theUpdatedAt != null ? theUpdatedAt : this.createdAt;
    }

    /**
     * Creates a new requirement.
     *
     * @param projectId the owning project
     * @param externalId the ID in the source system, may be null
     * @param title the title, 3 to 500 characters
     * @param description the description, may be null
     * @param source the source, defaults to manual
     * @param status the status, defaults to draft
     * @param customFields free-form fields, may be null
     * @param createdBy the creating user, may be null
     * @return a new Requirement
     */
    public static Requirement create(final String projectId,
            final String externalId, final String title,
            final String description, final RequirementSource source,
            final RequirementStatus status,
            final Map<String, Object> customFields, final String createdBy) {
        final Requirement requirement = new Requirement(
                UUID.randomUUID().toString(), projectId, title, source,
                status, createdBy, Instant.now(), null);
        requirement.externalId = externalId;
        requirement.description = description;
        requirement.customFields = customFields;
        return requirement;
    }

    public static Requirement reconstitute(final String id,
            final String projectId, final String externalId,
            final String title, final String description,
            final RequirementSource source, final RequirementStatus status,
            final Map<String, Object> customFields, final String createdBy,
            final Instant createdAt, final Instant updatedAt) {
        final Requirement requirement = new Requirement(id, projectId, title,
                source, status, createdBy, createdAt, updatedAt);
        requirement.externalId = externalId;
        requirement.description = description;
        requirement.customFields = customFields;
        return requirement;
    }

    /**
     * Applies a partial update. Null arguments leave the field untouched.
     *
     * @param newExternalId the new external ID
     * @param newTitle the new title
     * @param newDescription the new description
     * @param newSource the new source
     * @param newStatus the new status
     * @param newCustomFields the new custom fields
     */
    public void update(final String newExternalId, final String newTitle,
            final String newDescription, final RequirementSource newSource,
            final RequirementStatus newStatus,
            final Map<String, Object> newCustomFields) {
        if (newExternalId != null) {
            this.externalId = newExternalId;
        }
        if (newTitle != null) {
            this.title = validTitle(newTitle);
        }
        if (newDescription != null) {
            this.description = newDescription;
        }
        if (newSource != null) {
            this.source = newSource;
        }
        if (newStatus != null) {
            this.status = newStatus;
        }
        if (newCustomFields != null) {
            this.customFields = newCustomFields;
        }
        this.updatedAt = Instant.now();
    }

    private static String validTitle(final String value) {
        return Preconditions.requireLength(value, 3, 500,
                "Requirement title");
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String externalId() {
        return externalId;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public RequirementSource source() {
        return source;
    }

    public RequirementStatus status() {
        return status;
    }

    public Map<String, Object> customFields() {
        return customFields;
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

}
