package co.fanki.qualityhub.run.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The outcome of one test case inside a run, pinned to the case version
 * that was executed.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TestResult {

    private final String id;
    private final String runId;
    private final String caseId;
    private final int caseVersion;
    private TestResultStatus status;
    private String comment;
    private Integer elapsedSeconds;
    private List<String> defects;
    private String executedBy;
    private Instant executedAt;
    private final Instant createdAt;
    private Instant updatedAt;

    private TestResult(final String theId, final String theRunId,
            final String theCaseId, final int theCaseVersion,
            final TestResultStatus theStatus, final Instant theCreatedAt,
            final Instant theUpdatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Test result ID is required");
        this.runId = Preconditions.requireNonBlank(theRunId,
                "Test run ID is required");
        this.caseId = Preconditions.requireNonBlank(theCaseId,
                "Test case ID is required");
        Preconditions.require(theCaseVersion >= 1,
                "Case version starts at 1");
        this.caseVersion = theCaseVersion;
        this.status = Preconditions.requireNonNull(theStatus,
                "Status is required");
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
        this.updatedAt = theUpdatedAt != null ? theUpdatedAt : this.createdAt;
    }

    /**
     * Records a result. A result created with an outcome other than
     * untested counts as executed right away.
     *
     * @param runId the run
     * @param caseId the executed case
     * @param caseVersion the version of the case at execution time
     * @param status the outcome, defaults to untested
     * @param comment the comment, may be null
     * @param elapsedSeconds time spent, may be null
     * @param defects linked defect IDs, may be null
     * @param userId the recording user, may be null
     * @return a new TestResult
     */
    public static TestResult record(final String runId, final String caseId,
            final int caseVersion, final TestResultStatus status,
            final String comment, final Integer elapsedSeconds,
            final List<String> defects, final String userId) {
        final TestResultStatus initial = status != null
                ? status : TestResultStatus.UNTESTED;
        final TestResult result = new TestResult(UUID.randomUUID().toString(),
                runId, caseId, caseVersion, initial, Instant.now(), null);
        result.comment = comment;
        result.elapsedSeconds = validElapsed(elapsedSeconds);
        result.defects = defects != null ? List.copyOf(defects) : null;
        if (initial != TestResultStatus.UNTESTED) {
            result.executedAt = result.createdAt;
            result.executedBy = userId;
        }
        return result;
    }

    /**
     * Creates a placeholder for a case that still has to be executed.
     *
     * @param runId the run
     * @param caseId the case
     * @param caseVersion the current version of the case
     * @return a new untested TestResult
     */
    public static TestResult pending(final String runId, final String caseId,
            final int caseVersion) {
        return record(runId, caseId, caseVersion, TestResultStatus.UNTESTED,
                null, null, null, null);
    }

    /**
     * Reconstitutes a result from persistence.
     *
     * @param id the ID
     * @param runId the run
     * @param caseId the case
     * @param caseVersion the executed case version
     * @param status the outcome
     * @param comment the comment
     * @param elapsedSeconds time spent
     * @param defects linked defects
     * @param executedBy who executed it
     * @param executedAt when executed
     * @param createdAt when created
     * @param updatedAt when last updated
     * @return the reconstituted TestResult
     */
    public static TestResult reconstitute(final String id, final String runId,
            final String caseId, final int caseVersion,
            final TestResultStatus status, final String comment,
            final Integer elapsedSeconds, final List<String> defects,
            final String executedBy, final Instant executedAt,
            final Instant createdAt, final Instant updatedAt) {
        final TestResult result = new TestResult(id, runId, caseId,
                caseVersion, status, createdAt, updatedAt);
        result.comment = comment;
        result.elapsedSeconds = elapsedSeconds;
        result.defects = defects;
        result.executedBy = executedBy;
        result.executedAt = executedAt;
        return result;
    }

    /**
     * Applies a partial update. The first move away from untested stamps
     * who executed the case and when.
     *
     * @param newStatus the new outcome
     * @param newComment the new comment
     * @param newElapsedSeconds the new elapsed time
     * @param newDefects the new defect list
     * @param userId the user making the change
     */
    public void update(final TestResultStatus newStatus,
            final String newComment, final Integer newElapsedSeconds,
            final List<String> newDefects, final String userId) {
        if (newStatus != null) {
            if (newStatus != TestResultStatus.UNTESTED
                    && status == TestResultStatus.UNTESTED) {
                this.executedAt = Instant.now();
                if (userId != null) {
                    this.executedBy = userId;
                }
            }
            this.status = newStatus;
        }
        if (newComment != null) {
            this.comment = newComment;
        }
        if (newElapsedSeconds != null) {
            this.elapsedSeconds = validElapsed(newElapsedSeconds);
        }
        if (newDefects != null) {
            this.defects = List.copyOf(newDefects);
        }
        this.updatedAt = Instant.now();
    }

    private static Integer validElapsed(final Integer value) {
        if (value != null) {
            Preconditions.requireNonNegative(value,
                    "Elapsed time must not be negative");
        }
        return value;
    }

    public String id() {
        return id;
    }

    public String runId() {
        return runId;
    }

    public String caseId() {
        return caseId;
    }

    public int caseVersion() {
        return caseVersion;
    }

    public TestResultStatus status() {
        return status;
    }

    public String comment() {
        return comment;
    }

    public Integer elapsedSeconds() {
        return elapsedSeconds;
    }

    public List<String> defects() {
        return defects != null ? defects : List.of();
    }

    public String executedBy() {
        return executedBy;
    }

    public Instant executedAt() {
        return executedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

}
