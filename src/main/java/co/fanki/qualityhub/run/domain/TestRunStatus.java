package co.fanki.qualityhub.run.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a test run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TestRunStatus {

    NOT_STARTED("not_started"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    ABORTED("aborted");

    private final String value;

    TestRunStatus(final String theValue) {
        this.value = theValue;
    }

    /**
     * Whether the run has been finished, either normally or by closing it.
     *
     * @return true for completed and aborted runs
     */
    public boolean isFinished() {
        return this == COMPLETED || this == ABORTED;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TestRunStatus fromValue(final String value) {
        for (final TestRunStatus each : values()) {
            if (each.value.equalsIgnoreCase(value)) {
                return each;
            }
        }
        throw new IllegalArgumentException("Unknown test run status: " + value);
    }

}
