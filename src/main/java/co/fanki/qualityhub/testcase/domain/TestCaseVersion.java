package co.fanki.qualityhub.testcase.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of a test case at one version.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TestCaseVersion {

    private final String id;
    private final String caseId;
    private final int version;
    private final Map<String, Object> data;
    private final String changedBy;
    private final Instant createdAt;

    private TestCaseVersion(final String theId, final String theCaseId,
            final int theVersion, final Map<String, Object> theData,
            final String theChangedBy, final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Version ID is required");
        this.caseId = Preconditions.requireNonBlank(theCaseId,
                "Test case ID is required");
        this.version = theVersion;
        this.data = Preconditions.requireNonNull(theData,
                "Snapshot data is required");
        this.changedBy = theChangedBy;
        this.createdAt = theCreatedAt;
    }

    /**
     * Snapshots the current state of a test case.
     *
     * @param testCase the test case
     * @param changedBy the user that made the change, may be null
     * @return the snapshot
     */
    public static TestCaseVersion of(final TestCase testCase,
            final String changedBy) {
        return new TestCaseVersion(UUID.randomUUID().toString(),
                testCase.id(), testCase.version(), testCase.snapshot(),
                changedBy, Instant.now());
    }

    public static TestCaseVersion reconstitute(final String id,
            final String caseId, final int version,
            final Map<String, Object> data, final String changedBy,
            final Instant createdAt) {
        return new TestCaseVersion(id, caseId, version, data, changedBy,
                createdAt);
    }

    public String id() {
        return id;
    }

    public String caseId() {
        return caseId;
    }

    public int version() {
        return version;
    }

    public Map<String, Object> data() {
        return data;
    }

    public String changedBy() {
        return changedBy;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
