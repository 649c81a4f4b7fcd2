package co.fanki.qualityhub.plan.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * An ordered selection of test cases, optionally aimed at a milestone.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TestPlan {

    private final String id;
    private final String projectId;
    private String milestoneId;
    private String name;
    private String description;
    private final Instant createdAt;
    private Instant updatedAt;

    private TestPlan(final String theId, final String theProjectId,
            final String theMilestoneId, final String theName,
            final String theDescription, final Instant theCreatedAt,
            final Instant theUpdatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Test plan ID is required");
        this.projectId = Preconditions.requireNonBlank(theProjectId,
                "Project ID is required");
        this.milestoneId = theMilestoneId;
        this.name = Preconditions.requireLength(theName, 1, 255,
                "Test plan name");
        this.description = theDescription;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = theUpdatedAt != null ? theUpdatedAt : this.createdAt;
    }

    /**
     * Creates a new plan.
     *
     * @param projectId the owning project
     * @param milestoneId the milestone, may be null
     * @param name the name
     * @param description the description, may be null
     * @return a new TestPlan
     */
    public static TestPlan create(final String projectId,
            final String milestoneId, final String name,
            final String description) {
        return new TestPlan(UUID.randomUUID().toString(), projectId,
                milestoneId, name, description, Instant.now(), null);
    }

    public static TestPlan reconstitute(final String id,
            final String projectId, final String milestoneId,
            final String name, final String description,
            final Instant createdAt, final Instant updatedAt) {
        return new TestPlan(id, projectId, milestoneId, name, description,
                createdAt, updatedAt);
    }

    /**
     * Applies a partial update. Null arguments leave the field untouched.
     *
     * @param newMilestoneId the new milestone
     * @param newName the new name
     * @param newDescription the new description
     */
    public void update(final String newMilestoneId, final String newName,
            final String newDescription) {
        if (newMilestoneId != null) {
            this.milestoneId = newMilestoneId;
        }
        if (newName != null) {
            this.name = Preconditions.requireLength(newName, 1, 255,
                    "Test plan name");
        }
        if (newDescription != null) {
            this.description = newDescription;
        }
        this.updatedAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String milestoneId() {
        return milestoneId;
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

    public Instant updatedAt() {
        return updatedAt;
    }

}
