package co.fanki.qualityhub.requirement.domain;

import co.fanki.qualityhub.shared.Preconditions;

import java.time.Instant;
import java.util.UUID;

/**
 * Link stating that a test case covers a requirement.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RequirementCoverage {

    private final String id;
    private final String requirementId;
    private final String caseId;
    private final String createdBy;
    private final Instant createdAt;

    private RequirementCoverage(final String theId,
            final String theRequirementId, final String theCaseId,
            final String theCreatedBy, final Instant theCreatedAt) {
        this.id = Preconditions.requireNonBlank(theId,
                "Coverage ID is required");
        this.requirementId = Preconditions.requireNonBlank(theRequirementId,
                "Requirement ID is required");
        this.caseId = Preconditions.requireNonBlank(theCaseId,
                "Test case ID is required");
        this.createdBy = theCreatedBy;
        this.createdAt = theCreatedAt != null ? theCreatedAt : Instant.now();
    }

    public static RequirementCoverage link(final String requirementId,
            final String caseId, final String createdBy) {
        return new RequirementCoverage(UUID.randomUUID().toString(),
                requirementId, caseId, createdBy, Instant.now());
    }

    public static RequirementCoverage reconstitute(final String id,
            final String requirementId, final String caseId,
            final String createdBy, final Instant createdAt) {
        return new RequirementCoverage(id, requirementId, caseId, createdBy,
                createdAt);
    }

    public String id() {
        return id;
    }

    public String requirementId() {
        return requirementId;
    }

    public String caseId() {
        return caseId;
    }

    public String createdBy() {
        return createdBy;
    }

    public Instant createdAt() {
        return createdAt;
    }

}
