package co.fanki.qualityhub.run.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Aggregate root for one execution of a set of test cases.
 *
 * <p>{@code startedAt} is stamped the first time the run goes in progress
 * and {@code completedAt} the first time it finishes. Start, complete and
 * close always move the run to their state.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TestRun {

    private final String id;
    private final String projectId;
    private String planId;
    private String name;
    private String description;
    private TestRunStatus status;
    private Map<String, Object> config;
    private String assigneeId;
    private Instant startedAt;
    private Instant completedAt;
    private final Instant createdAt;
    private Instant updatedAt;

    private TestRun(final String theId, final String theProjectId,
            final String theName, final TestRunStatus theStatus,
            final Instant theCreatedAt, final Instant theUpdatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Test run ID is required");
        this.projectId = Preconditions.requireNonBlank(theProjectId,
                "Project ID is required");
        this.name = Preconditions.requireLength(theName, 1, 255,
                "Test run name");
        this.status = Preconditions.requireNonNull(theStatus,
                "Status is required");
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = theUpdatedAt != null ? theUpdatedAt : this.createdAt;
    }

    /**
     * Creates a run that has not started yet.
     *
     * @param projectId the owning project
     * @param planId the plan it executes, may be null
     * @param name the name
     * @param description the description, may be null
     * @param config free-form configuration, may be null
     * @param assigneeId the assigned tester, may be null
     * @return a new TestRun
     */
    public static TestRun create(final String projectId, final String planId,
            final String name, final String description,
            final Map<String, Object> config, final String assigneeId) {
        final TestRun run = new TestRun(UUID.randomUUID().toString(),
                projectId, name, TestRunStatus.NOT_STARTED, Instant.now(),
                null);
        run.planId = planId;
        run.description = description;
        run.config = config;
        run.assigneeId = assigneeId;
        return run;
    }

    /**
     * Reconstitutes a run from persistence.
     *
     * @param id the ID
     * @param projectId the project
     * @param planId the plan
     * @param name the name
     * @param description the description
     * @param status the status
     * @param config the configuration
     * @param assigneeId the assignee
     * @param startedAt when started
     * @param completedAt when finished
     * @param createdAt when created
     * @param updatedAt when last updated
     * @return the reconstituted TestRun
     */
    public static TestRun reconstitute(final String id,
            final String projectId, final String planId, final String name,
            final String description, final TestRunStatus status,
            final Map<String, Object> config, final String assigneeId,
            final Instant startedAt, final Instant completedAt,
            final Instant createdAt, final Instant updatedAt) {
        final TestRun run = new TestRun(id, projectId, name, status,
                createdAt, updatedAt);
        run.planId = planId;
        run.description = description;
        run.config = config;
        run.assigneeId = assigneeId;
        run.startedAt = startedAt;
        run.completedAt = completedAt;
        return run;
    }

    /**
     * Applies a partial update. Null arguments leave the field untouched.
     *
     * @param newName the new name
     * @param newDescription the new description
     * @param newConfig the new configuration
     * @param newAssigneeId the new assignee
     * @param newStatus the new status
     */
    public void update(final String newName, final String newDescription,
            final Map<String, Object> newConfig, final String newAssigneeId,
            final TestRunStatus newStatus) {
        if (newName != null) {
            this.name = Preconditions.requireLength(newName, 1, 255,
                    "Test run name");
        }
        if (newDescription != null) {
            this.description = newDescription;
        }
        if (newConfig != null) {
            this.config = newConfig;
        }
        if (newAssigneeId != null) {
            this.assigneeId = newAssigneeId;
        }
        if (newStatus != null) {
            transitionTo(newStatus);
        }
        this.updatedAt = Instant.now();
    }

    /** Puts the run in progress, restarting its clock. */
    public void start() {
        this.status = TestRunStatus.IN_PROGRESS;
        this.startedAt = Instant.now();
        this.updatedAt = startedAt;
    }

    /** Marks the run as completed now. */
    public void complete() {
        finish(TestRunStatus.COMPLETED);
    }

    /** Closes the run without completing it. */
    public void close() {
        finish(TestRunStatus.ABORTED);
    }

    private void finish(final TestRunStatus finalStatus) {
        this.status = finalStatus;
        this.completedAt = Instant.now();
        this.updatedAt = completedAt;
    }

    private void transitionTo(final TestRunStatus newStatus) {
        if (newStatus == TestRunStatus.IN_PROGRESS && startedAt == null) {
            this.startedAt = Instant.now();
        }
        if (newStatus.isFinished() && completedAt == null) {
            this.completedAt = Instant.now();
        }
        this.status = newStatus;
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String planId() {
        return planId;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public TestRunStatus status() {
        return status;
    }

    public Map<String, Object> config() {
        return config;
    }

    public String assigneeId() {
        return assigneeId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

}
