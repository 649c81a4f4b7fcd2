package co.fanki.qualityhub.requirement.domain;

import co.fanki.qualityhub.shared.Percentages;
import co.fanki.qualityhub.shared.Preconditions;

/**
 * How many of a project's requirements are covered by at least one test
 * case.
 *
 * @param totalRequirements live requirements of the project
 * @param coveredRequirements requirements with one or more linked cases
 * @param uncoveredRequirements requirements with no linked case
 * @param coveragePercentage covered over total, rounded to an integer
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CoverageStatistics(
        long totalRequirements,
        long coveredRequirements,
        long uncoveredRequirements,
        int coveragePercentage
) {

    /**
     * Statistics of a project without requirements.
     *
     * @return all zeros
     */
    public static CoverageStatistics empty() {
        return new CoverageStatistics(0, 0, 0, 0);
    }

    /**
     * Derives the statistics from the two counts.
     *
     * @param total live requirements
     * @param covered covered requirements, never above total
     * @return the statistics
     */
    public static CoverageStatistics of(final long total, final long covered) {
        Preconditions.require(covered >= 0 && covered <= total,
                "Covered requirements must be between 0 and the total");
        return new CoverageStatistics(total, covered, total - covered,
                Percentages.of(covered, total));
    }

}
