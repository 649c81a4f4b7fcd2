package co.fanki.qualityhub.shared;

/**
 * Integer percentages as shown on dashboards and reports.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Percentages {

    private Percentages() {
    }

    /**
     * Computes {@code round(part / whole * 100)}.
     *
     * <p>Halves round up, so 1/8 gives 13. A whole of zero yields 0.</p>
     *
     * @param part the counted subset, between 0 and whole
     * @param whole the total, never negative
     * @return the percentage in [0, 100] for valid input
     */
    public static int of(final long part, final long whole) {
        if (whole <= 0) {
            return 0;
        }
        return (int) Math.round((double) part / whole * 100);
    }

    /**
     * Rounds a percentage to two decimals.
     *
     * @param part the counted subset
     * @param whole the total
     * @return the percentage with two decimals, 0 when whole is zero
     */
    public static double precise(final long part, final long whole) {
        if (whole <= 0) {
            return 0;
        }
        return Math.round((double) part / whole * 10000) / 100.0;
    }

}
