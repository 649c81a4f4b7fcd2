package co.fanki.qualityhub.run.domain;

import co.fanki.qualityhub.shared.Percentages;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Count of results per status for one run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StatusTally {

    private final Map<TestResultStatus, Long> counts;

    private StatusTally(final Map<TestResultStatus, Long> theCounts) {
        this.counts = theCounts;
    }

    /**
     * Builds a tally from grouped counts. Missing statuses count as zero.
     *
     * @param counts the count per status
     * @return the tally
     */
    public static StatusTally of(final Map<TestResultStatus, Long> counts) {
        final Map<TestResultStatus, Long> copy = new EnumMap<>(
                TestResultStatus.class);
        copy.putAll(counts);
        return new StatusTally(Collections.unmodifiableMap(copy));
    }

    public long count(final TestResultStatus status) {
        return counts.getOrDefault(status, 0L);
    }

    /**
     * Adds up the counts of several statuses.
     *
     * @param statuses the statuses to add
     * @return the sum, 0 when none is given
     */
    public long sum(final TestResultStatus... statuses) {
        long sum = 0;
        for (TestResultStatus status : statuses) {
            sum += count(status);
        }
        return sum;
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    /**
     * Results that are no longer untested.
     *
     * @return total minus untested
     */
    public long executed() {
        return total() - count(TestResultStatus.UNTESTED);
    }

    /**
     * Share of executed results among all results.
     *
     * @return the rounded percentage, 0 for an empty run
     */
    public int progressPercentage() {
        return Percentages.of(executed(), total());
    }

    /**
     * Share of passed results among executed ones.
     *
     * @return the rounded percentage, 0 when nothing was executed
     */
    public int passRate() {
        return Percentages.of(count(TestResultStatus.PASSED), executed());
    }

}
