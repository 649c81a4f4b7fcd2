package co.fanki.qualityhub.report.domain;

import co.fanki.qualityhub.requirement.domain.RequirementStatus;

import java.time.Instant;
import java.util.List;

/**
 * Requirement coverage of a project, one line per requirement in creation
 * order.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CoverageReport(
        String projectId,
        long totalRequirements,
        long coveredRequirements,
        long uncoveredRequirements,
        int coveragePercentage,
        List<RequirementLine> requirements,
        Instant generatedAt
) {

    /** Coverage of a single requirement. */
    public record RequirementLine(
            String requirementId,
            String externalId,
            String title,
            RequirementStatus status,
            long linkedTestCases
    ) {

        public boolean isCovered() {
            return linkedTestCases > 0;
        }
    }

}
