package co.fanki.qualityhub.testcase.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How urgently a test case should be executed.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum TestCasePriority {

    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    TestCasePriority(final String theValue) {
        this.value = theValue;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TestCasePriority fromValue(final String value) {
        for (final TestCasePriority each : values()) {
            if (each.value.equalsIgnoreCase(value)) {
                return each;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }

}
