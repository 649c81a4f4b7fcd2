package co.fanki.qualityhub.milestone.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * A release target of a project that test plans are grouped under.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Milestone {

    private final String id;
    private final String projectId;
    private String name;
    private String description;
    private Instant dueDate;
    private boolean completed;
    private final Instant createdAt;
    private Instant updatedAt;

    private Milestone(final String theId, final String theProjectId,
            final String theName, final String theDescription,
            final Instant theDueDate, final boolean isCompleted,
            final Instant theCreatedAt, final Instant theUpdatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Milestone ID is required");
        this.projectId = Preconditions.requireNonBlank(theProjectId,
                "Project ID is required");
        this.name = Preconditions.requireLength(theName, 1, 255,
                "Milestone name");
        this.description = theDescription;
        this.dueDate = theDueDate;
        this.completed = isCompleted;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = theUpdatedAt != null ? theUpdatedAt : this.createdAt;
    }

    /**
     * Creates a new, open milestone.
     *
     * @param projectId the owning project
     * @param name the name
     * @param description the description, may be null
     * @param dueDate the due date, may be null
     * @return a new Milestone
     */
    public static Milestone create(final String projectId, final String name,
            final String description, final Instant dueDate) {
        return new Milestone(UUID.randomUUID().toString(), projectId, name,
                description, dueDate, false, Instant.now(), null);
    }

    public static Milestone reconstitute(final String id,
            final String projectId, final String name,
            final String description, final Instant dueDate,
            final boolean completed, final Instant createdAt,
            final Instant updatedAt) {
        return new Milestone(id, projectId, name, description, dueDate,
                completed, createdAt, updatedAt);
    }

    /**
     * Applies a partial update. Null arguments leave the field untouched.
     *
     * @param newName the new name
     * @param newDescription the new description
     * @param newDueDate the new due date
     * @param isCompleted the new completion flag
     */
    public void update(final String newName, final String newDescription,
            final Instant newDueDate, final Boolean isCompleted) {
        if (newName != null) {
            this.name = Preconditions.requireLength(newName, 1, 255,
                    "Milestone name");
        }
        if (newDescription != null) {
            this.description = newDescription;
        }
        if (newDueDate != null) {
            this.dueDate = newDueDate;
        }
        if (isCompleted != null) {
            this.completed = isCompleted;
        }
        this.updatedAt = Instant.now();
    }

    /**
     * Progress of the milestone. Completion is all or nothing.
     *
     * @return 100 when completed, 0 otherwise
     */
    public int progressPercentage() {
        return completed ? 100 : 0;
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

    public Instant dueDate() {
        return dueDate;
    }

    public boolean isCompleted() {
        return completed;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

}
