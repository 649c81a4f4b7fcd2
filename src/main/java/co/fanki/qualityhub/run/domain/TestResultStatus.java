package co.fanki.qualityhub.run.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of executing one test case inside a run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TestResultStatus {

    UNTESTED("untested"),
    PASSED("passed"),
    FAILED("failed"),
    BLOCKED("blocked"),
    RETEST("retest"),
    SKIPPED("skipped");

    private final String value;

    TestResultStatus(final String theValue) {
        this.value = theValue;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TestResultStatus fromValue(final String value) {
        for (final TestResultStatus each : values()) {
            if (each.value.equalsIgnoreCase(value)) {
                return each;
            }
        }
        throw new IllegalArgumentException("Unknown test result status: " + value);
    }

}
