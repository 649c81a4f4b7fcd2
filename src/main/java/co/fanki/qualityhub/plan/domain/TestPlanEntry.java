package co.fanki.qualityhub.plan.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * A test case placed in a plan at a position.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class TestPlanEntry {

    private final String id;
    private final String planId;
    private final String caseId;
    private int position;
    private final Instant createdAt;

    private TestPlanEntry(final String theId, final String thePlanId,
            final String theCaseId, final int thePosition,
            final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId, "Entry ID is required");
        this.planId = Preconditions.requireNonBlank(thePlanId,
                "Test plan ID is required");
        this.caseId = Preconditions.requireNonBlank(theCaseId,
                "Test case ID is required");
        this.position = Preconditions.requireNonNegative(thePosition,
                "Position must not be negative");
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    public static TestPlanEntry create(final String planId,
            final String caseId, final int position) {
        return new TestPlanEntry(UUID.randomUUID().toString(), planId, caseId,
                position, Instant.now());
    }

    public static TestPlanEntry reconstitute(final String id,
            final String planId, final String caseId, final int position,
            final Instant createdAt) {
        return new TestPlanEntry(id, planId, caseId, position, createdAt);
    }

    public void moveTo(final int newPosition) {
        this.position = Preconditions.requireNonNegative(newPosition,
                "Position must not be negative");
    }

    public String id() {
        return id;
    }

    public String planId() {
        return planId;
    }

    public String caseId() {
        return caseId;
    }

    public int position() {
        return position;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
